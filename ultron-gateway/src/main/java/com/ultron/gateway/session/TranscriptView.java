package com.ultron.gateway.session;

import java.util.List;

/**
 * Read-time pruned copy of a transcript handed to the agent.
 *
 * @param totalTurns          turns in the stored transcript
 * @param droppedToolResults  old tool results left out
 * @param droppedOldest       oldest turns left out to respect the max
 */
public record TranscriptView(
        String sessionKey,
        List<TranscriptTurn> turns,
        int totalTurns,
        int droppedToolResults,
        int droppedOldest) {

    public TranscriptView {
        turns = turns != null ? List.copyOf(turns) : List.of();
    }

    public static TranscriptView empty(String sessionKey) {
        return new TranscriptView(sessionKey, List.of(), 0, 0, 0);
    }

    public boolean isPruned() {
        return droppedToolResults > 0 || droppedOldest > 0;
    }
}
