package com.ultron.gateway.agent;

/**
 * One piece of agent output.
 */
public record ResponseBlock(Kind kind, String text, String toolName) {

    public enum Kind {
        /** Reply text for the user. */
        TEXT,
        /** Output of a tool call, recorded in the transcript only. */
        TOOL_RESULT
    }

    public static ResponseBlock text(String text) {
        return new ResponseBlock(Kind.TEXT, text, null);
    }

    public static ResponseBlock toolResult(String toolName, String text) {
        return new ResponseBlock(Kind.TOOL_RESULT, text, toolName);
    }
}
