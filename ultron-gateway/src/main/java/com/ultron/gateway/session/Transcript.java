package com.ultron.gateway.session;

import java.util.List;

/**
 * Ordered turns of one session, as stored.
 */
public record Transcript(String sessionId, String sessionKey, List<TranscriptTurn> turns) {

    public Transcript {
        turns = turns != null ? List.copyOf(turns) : List.of();
    }

    public int size() {
        return turns.size();
    }
}
