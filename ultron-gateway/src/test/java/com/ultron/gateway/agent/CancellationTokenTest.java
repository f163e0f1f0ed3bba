package com.ultron.gateway.agent;

import com.ultron.gateway.inbound.InboundMessage;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Nested
    class Token {
        @Test
        void firstCancelWins() {
            var token = new CancellationToken();
            assertTrue(token.cancel("interrupted"));
            assertFalse(token.cancel("reset"));
            assertEquals("interrupted", token.getReason());
        }

        @Test
        void listenersRunOnce() {
            var token = new CancellationToken();
            var calls = new AtomicInteger();
            token.onCancel(calls::incrementAndGet);

            token.cancel("x");
            token.cancel("y");

            assertEquals(1, calls.get());
        }

        @Test
        void lateListener_runsImmediately() {
            var token = new CancellationToken();
            token.cancel(null);
            var calls = new AtomicInteger();

            token.onCancel(calls::incrementAndGet);

            assertEquals(1, calls.get());
            assertEquals("cancelled", token.getReason());
        }

        @Test
        void listenerRacingCancel_runsExactlyOnce() throws Exception {
            for (int round = 0; round < 500; round++) {
                var token = new CancellationToken();
                var calls = new AtomicInteger();
                var gate = new CountDownLatch(1);
                Thread canceller = new Thread(() -> {
                    awaitQuietly(gate);
                    token.cancel("race");
                });
                canceller.start();
                gate.countDown();
                token.onCancel(calls::incrementAndGet);
                canceller.join();

                assertEquals(1, calls.get(), "round " + round);
            }
        }

        @Test
        void throwIfCancelled() {
            var token = new CancellationToken();
            assertDoesNotThrow(token::throwIfCancelled);
            token.cancel("stop");
            var e = assertThrows(CancellationException.class, token::throwIfCancelled);
            assertEquals("stop", e.getMessage());
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Nested
    class Inbox {
        private InboundMessage msg(String body) {
            return InboundMessage.builder().provider("p").body(body).build();
        }

        @Test
        void drainTakesPendingInOrder() {
            var inbox = new SteeringInbox();
            inbox.offer(List.of(msg("a"), msg("b")));

            assertEquals(2, inbox.drain().size());
            assertFalse(inbox.hasPending());
            assertEquals(2, inbox.drainedMessages().size());
        }

        @Test
        void closeReturnsLeftoversAndRejectsOffers() {
            var inbox = new SteeringInbox();
            inbox.offer(List.of(msg("a")));
            inbox.drain();
            inbox.offer(List.of(msg("b")));

            List<InboundMessage> leftovers = inbox.close();

            assertEquals(List.of("b"), leftovers.stream().map(InboundMessage::body).toList());
            assertFalse(inbox.offer(List.of(msg("c"))));
            assertTrue(inbox.isClosed());
        }
    }
}
