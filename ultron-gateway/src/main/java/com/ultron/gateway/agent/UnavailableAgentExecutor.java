package com.ultron.gateway.agent;

import java.util.concurrent.CompletableFuture;

/**
 * Used when no agent runtime is wired in. Every run fails, so senders get
 * the configured error reply.
 */
public class UnavailableAgentExecutor implements AgentExecutor {

    @Override
    public CompletableFuture<RunSummary> run(AgentRunRequest request, ResponseSink sink) {
        return CompletableFuture.failedFuture(
                new IllegalStateException("no agent executor configured for agent " + request.agentId()));
    }
}
