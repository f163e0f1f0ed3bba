package com.ultron.gateway.agent;

/**
 * Completion summary returned by an {@link AgentExecutor}.
 *
 * @param usage      token usage for the run
 * @param stopReason free-form reason the run ended, may be null
 */
public record RunSummary(TokenUsage usage, String stopReason) {

    public RunSummary {
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public static RunSummary of(TokenUsage usage) {
        return new RunSummary(usage, null);
    }
}
