package com.ultron.gateway.inbound;

import com.ultron.common.config.UltronConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InboundDebouncerTest {

    private final List<List<String>> batches = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstFlush = new CountDownLatch(1);
    private final InboundDebouncer<String> debouncer = new InboundDebouncer<>(batch -> {
        batches.add(batch);
        firstFlush.countDown();
    });

    @AfterEach
    void tearDown() {
        debouncer.shutdown();
    }

    @Nested
    class Batching {
        @Test
        void burstWithinWindow_flushesOnceInOrder() throws Exception {
            debouncer.offer("k", "m1", 400);
            Thread.sleep(150);
            debouncer.offer("k", "m2", 400);
            Thread.sleep(150);
            debouncer.offer("k", "m3", 400);

            // each offer restarts the quiet window
            Thread.sleep(200);
            assertTrue(batches.isEmpty());

            assertTrue(firstFlush.await(2, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertEquals(List.of(List.of("m1", "m2", "m3")), batches);
            assertEquals(0, debouncer.pendingKeys());
        }

        @Test
        void differentKeys_flushIndependently() throws Exception {
            debouncer.offer("a", "a1", 100);
            debouncer.offer("b", "b1", 100);
            Thread.sleep(500);
            assertEquals(2, batches.size());
            assertTrue(batches.contains(List.of("a1")));
            assertTrue(batches.contains(List.of("b1")));
        }

        @Test
        void zeroWindow_flushesPendingThenItem() {
            debouncer.offer("k", "m1", 10_000);
            debouncer.offer("k", "m2", 0);
            assertEquals(List.of(List.of("m1"), List.of("m2")), batches);
        }

        @Test
        void flushAll_deliversPendingBuffers() {
            debouncer.offer("a", "a1", 10_000);
            debouncer.offer("a", "a2", 10_000);
            debouncer.offer("b", "b1", 10_000);
            assertEquals(2, debouncer.pendingKeys());

            debouncer.flushAll();

            assertEquals(2, batches.size());
            assertTrue(batches.contains(List.of("a1", "a2")));
            assertEquals(0, debouncer.pendingKeys());
        }

        @Test
        void failingHandler_doesNotBreakLaterFlushes() {
            var seen = new CopyOnWriteArrayList<String>();
            var failing = new InboundDebouncer<String>(batch -> {
                seen.addAll(batch);
                throw new IllegalStateException("boom");
            });
            try {
                failing.offer("k", "x", 0);
                failing.offer("k", "y", 0);
                assertEquals(List.of("x", "y"), seen);
            } finally {
                failing.shutdown();
            }
        }
    }

    @Nested
    class Resolution {
        @Test
        void mediaEditsAndCommands_areNotDebounced() {
            var base = InboundMessage.builder().provider("telegram").body("hello").build();
            assertTrue(InboundDebouncer.shouldDebounce(base));
            assertFalse(InboundDebouncer.shouldDebounce(base.toBuilder().media(List.of("photo.jpg")).build()));
            assertFalse(InboundDebouncer.shouldDebounce(base.toBuilder().edited(true).build()));
            assertFalse(InboundDebouncer.shouldDebounce(base.toBuilder().body("  /reset").build()));
        }

        @Test
        void windowFromChannelOverride() {
            var inbound = new UltronConfig.InboundConfig();
            inbound.setDebounceMs(1_000L);
            inbound.setByChannel(Map.of("discord", 250L));

            assertEquals(250, InboundDebouncer.resolveDebounceMs(inbound, "Discord"));
            assertEquals(1_000, InboundDebouncer.resolveDebounceMs(inbound, "telegram"));
            assertEquals(0, InboundDebouncer.resolveDebounceMs(null, "telegram"));
        }

        @Test
        void key_ignoresCaseAndIncludesThread() {
            var msg = InboundMessage.builder().provider("Slack").accountId("A").peerId("C1")
                    .senderId("U1").threadId("T9").build();
            assertEquals("slack|a|c1|u1|t9", InboundDebouncer.buildKey(msg));
        }
    }
}
