package com.ultron.gateway.inbound;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InboundDedupeTest {

    private final AtomicLong now = new AtomicLong(1_000);

    @Test
    void redeliveredMessage_droppedWithinTtl() {
        var dedupe = new InboundDedupe(60_000, 100, now::get);
        assertTrue(dedupe.admit("telegram", "42"));
        now.addAndGet(30_000);
        assertFalse(dedupe.admit("telegram", "42"));
    }

    @Test
    void sameIdOnDifferentProvider_admitted() {
        var dedupe = new InboundDedupe(60_000, 100, now::get);
        assertTrue(dedupe.admit("telegram", "42"));
        assertTrue(dedupe.admit("discord", "42"));
    }

    @Test
    void providerIsCaseInsensitive() {
        var dedupe = new InboundDedupe(60_000, 100, now::get);
        assertTrue(dedupe.admit("Telegram", "42"));
        assertFalse(dedupe.admit("telegram ", "42"));
    }

    @Test
    void afterTtl_admittedAgain() {
        var dedupe = new InboundDedupe(5_000, 100, now::get);
        assertTrue(dedupe.admit("slack", "a"));
        now.addAndGet(5_000);
        assertTrue(dedupe.admit("slack", "a"));
    }

    @Test
    void missingId_alwaysAdmitted() {
        var dedupe = new InboundDedupe(60_000, 100, now::get);
        assertTrue(dedupe.admit("slack", null));
        assertTrue(dedupe.admit("slack", null));
        assertTrue(dedupe.admit(null, "x"));
        assertEquals(0, dedupe.size());
    }

    @Test
    void editedMessage_isDistinctFromOriginal() {
        var dedupe = new InboundDedupe(60_000, 100, now::get);
        var original = InboundMessage.builder().provider("telegram").messageId("7").timestamp(1).build();
        var edit = original.toBuilder().edited(true).timestamp(2).build();

        assertTrue(dedupe.admit(original));
        assertTrue(dedupe.admit(edit));
        assertFalse(dedupe.admit(edit));
    }

    @Test
    void sweep_removesExpired() {
        var dedupe = new InboundDedupe(1_000, 100, now::get);
        dedupe.admit("p", "1");
        dedupe.admit("p", "2");
        now.addAndGet(2_000);
        assertEquals(2, dedupe.sweep());
        assertEquals(0, dedupe.size());
    }
}
