package com.ultron.gateway.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-time transcript pruning. Never touches stored data.
 */
public final class TranscriptPruner {

    private TranscriptPruner() {
    }

    /**
     * Keep everything from the N-th most recent conversational turn onwards,
     * drop tool results before it, then trim to {@code maxTurns}: oldest turns
     * before the recent window go first, then tool results inside it. The
     * recent conversational turns are never dropped.
     */
    public static TranscriptView prune(Transcript transcript, PruningPolicy policy) {
        List<TranscriptTurn> turns = transcript.turns();
        int recentStart = recentWindowStart(turns, policy.keepRecentTurns());

        List<TranscriptTurn> older = new ArrayList<>();
        List<TranscriptTurn> recent = new ArrayList<>();
        int droppedToolResults = 0;
        for (int i = 0; i < turns.size(); i++) {
            TranscriptTurn turn = turns.get(i);
            if (i >= recentStart) {
                recent.add(turn);
            } else if (turn.role() == TurnRole.TOOL_RESULT) {
                droppedToolResults++;
            } else {
                older.add(turn);
            }
        }

        int excess = older.size() + recent.size() - policy.maxTurns();
        int droppedOldest = Math.max(0, Math.min(excess, older.size()));
        excess -= droppedOldest;

        List<TranscriptTurn> kept = new ArrayList<>(older.subList(droppedOldest, older.size()));
        for (TranscriptTurn turn : recent) {
            if (excess > 0 && turn.role() == TurnRole.TOOL_RESULT) {
                excess--;
                droppedToolResults++;
                continue;
            }
            kept.add(turn);
        }
        return new TranscriptView(transcript.sessionKey(), kept, turns.size(), droppedToolResults, droppedOldest);
    }

    /**
     * Index of the first turn in the protected recent window.
     */
    static int recentWindowStart(List<TranscriptTurn> turns, int keepRecentTurns) {
        if (keepRecentTurns <= 0) {
            return turns.size();
        }
        int seen = 0;
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role().isConversational()) {
                seen++;
                if (seen == keepRecentTurns) {
                    return i;
                }
            }
        }
        return 0;
    }
}
