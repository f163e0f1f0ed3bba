package com.ultron.gateway.session;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptPrunerTest {

    private static Transcript transcript(TranscriptTurn... turns) {
        return new Transcript("s1", "agent:main:main", List.of(turns));
    }

    @Test
    void oldToolResults_droppedRecentKept() {
        var t = transcript(
                TranscriptTurn.user("q1", 1),
                TranscriptTurn.toolResult("fetch", "old result", 2),
                TranscriptTurn.assistant("a1", 3),
                TranscriptTurn.user("q2", 4),
                TranscriptTurn.toolResult("fetch", "new result", 5),
                TranscriptTurn.assistant("a2", 6));

        TranscriptView view = TranscriptPruner.prune(t, new PruningPolicy(2, 50));

        assertEquals(5, view.turns().size());
        assertEquals(1, view.droppedToolResults());
        assertEquals(6, view.totalTurns());
        assertTrue(view.turns().stream().anyMatch(turn -> "new result".equals(turn.text())));
        assertTrue(view.isPruned());
        // stored transcript is unchanged
        assertEquals(6, t.size());
    }

    @Test
    void maxTurns_dropsOldest() {
        List<TranscriptTurn> turns = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            turns.add(TranscriptTurn.user("m" + i, i));
        }
        TranscriptView view = TranscriptPruner.prune(new Transcript("s1", "k", turns), new PruningPolicy(2, 5));

        assertEquals(5, view.turns().size());
        assertEquals(3, view.droppedOldest());
        assertEquals("m3", view.turns().get(0).text());
    }

    @Test
    void maxTurns_neverDropsRecentConversationalTurns() {
        List<TranscriptTurn> turns = new ArrayList<>();
        turns.add(TranscriptTurn.user("q0", 0));
        for (int i = 1; i <= 5; i++) {
            turns.add(TranscriptTurn.toolResult("fetch", "r" + i, i));
        }
        turns.add(TranscriptTurn.user("q1", 6));
        for (int i = 10; i <= 14; i++) {
            turns.add(TranscriptTurn.toolResult("fetch", "r" + i, i));
        }

        TranscriptView view = TranscriptPruner.prune(new Transcript("s1", "k", turns), new PruningPolicy(2, 5));

        assertEquals(List.of("q0", "q1", "r12", "r13", "r14"),
                view.turns().stream().map(TranscriptTurn::text).toList());
        assertEquals(7, view.droppedToolResults());
        assertEquals(0, view.droppedOldest());
        assertEquals(12, turns.size());
    }

    @Test
    void maxTurns_keepsRecentWindowEvenWhenLargerThanCap() {
        List<TranscriptTurn> turns = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            turns.add(TranscriptTurn.user("m" + i, i));
        }
        TranscriptView view = TranscriptPruner.prune(new Transcript("s1", "k", turns), new PruningPolicy(4, 2));

        assertEquals(4, view.turns().size());
        assertEquals("m2", view.turns().get(0).text());
        assertEquals(2, view.droppedOldest());
    }

    @Test
    void shortTranscript_untouched() {
        var t = transcript(TranscriptTurn.user("q", 1), TranscriptTurn.toolResult("x", "r", 2));
        TranscriptView view = TranscriptPruner.prune(t, PruningPolicy.DEFAULT);
        assertEquals(2, view.turns().size());
        assertFalse(view.isPruned());
    }

    @Test
    void zeroKeepRecent_dropsAllToolResults() {
        var t = transcript(TranscriptTurn.user("q", 1), TranscriptTurn.toolResult("x", "r", 2));
        TranscriptView view = TranscriptPruner.prune(t, new PruningPolicy(0, 10));
        assertEquals(1, view.turns().size());
    }
}
