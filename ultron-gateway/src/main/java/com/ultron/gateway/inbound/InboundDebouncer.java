package com.ultron.gateway.inbound;

import com.ultron.common.config.UltronConfig;
import com.ultron.common.logging.SubsystemLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Inbound message debouncing: buffers items by key and flushes the whole
 * buffer as one ordered batch once the key has been quiet for its window.
 *
 * <p>
 * Every offer replaces the key's buffer inside
 * {@link ConcurrentHashMap#compute} and bumps its generation; a timer only
 * flushes the buffer if the generation it was scheduled for is still
 * current. Flushes are delivered under a single lock so a timer flush and an
 * immediate flush for the same key cannot overtake each other.
 * </p>
 *
 * @param <T> item type
 */
public class InboundDebouncer<T> {

    private static final SubsystemLogger log = SubsystemLogger.create("gateway/inbound").child("debounce");

    private final Consumer<List<T>> onFlush;
    private final Map<String, Buffer<T>> buffers = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final Object deliveryLock = new Object();
    private final ScheduledExecutorService scheduler;

    public InboundDebouncer(Consumer<List<T>> onFlush) {
        this.onFlush = onFlush;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inbound-debounce");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Offer an item under {@code key}. A window of 0 (or less) flushes any
     * pending batch for the key first and then the item on its own.
     */
    public void offer(String key, T item, long windowMs) {
        if (windowMs <= 0 || key == null || key.isEmpty()) {
            synchronized (deliveryLock) {
                if (key != null) {
                    Buffer<T> pending = buffers.remove(key);
                    if (pending != null) {
                        pending.cancelTimer();
                        deliver(key, pending.items);
                    }
                }
                deliver(key, List.of(item));
            }
            return;
        }

        buffers.compute(key, (k, existing) -> {
            List<T> items = new ArrayList<>();
            if (existing != null) {
                existing.cancelTimer();
                items.addAll(existing.items);
            }
            items.add(item);
            long generation = generations.incrementAndGet();
            Buffer<T> next = new Buffer<>(Collections.unmodifiableList(items), generation);
            next.timer = scheduler.schedule(() -> fire(k, generation), windowMs, TimeUnit.MILLISECONDS);
            return next;
        });
    }

    /**
     * Flush every pending buffer now, e.g. on shutdown.
     */
    public void flushAll() {
        synchronized (deliveryLock) {
            for (String key : new ArrayList<>(buffers.keySet())) {
                Buffer<T> pending = buffers.remove(key);
                if (pending != null) {
                    pending.cancelTimer();
                    deliver(key, pending.items);
                }
            }
        }
    }

    /** Number of keys with a pending batch. */
    public int pendingKeys() {
        return buffers.size();
    }

    public void shutdown() {
        flushAll();
        scheduler.shutdownNow();
    }

    private void fire(String key, long generation) {
        synchronized (deliveryLock) {
            List<List<T>> taken = new ArrayList<>(1);
            buffers.computeIfPresent(key, (k, current) -> {
                if (current.generation != generation) {
                    return current;
                }
                taken.add(current.items);
                return null;
            });
            if (!taken.isEmpty()) {
                deliver(key, taken.get(0));
            }
        }
    }

    private void deliver(String key, List<T> items) {
        if (items.isEmpty()) {
            return;
        }
        try {
            onFlush.accept(items);
        } catch (Exception e) {
            log.error("debounce flush failed", Map.of("key", key, "items", items.size()), e);
        }
    }

    // =========================================================================
    // Key and window resolution
    // =========================================================================

    /**
     * Pre-routing identity: {@code provider|accountId|peerId|senderId|threadId}.
     */
    public static String buildKey(InboundMessage message) {
        return String.join("|",
                token(message.provider()),
                token(message.accountId()),
                token(message.peerId()),
                token(message.senderId()),
                token(message.threadId()));
    }

    /**
     * Media, edits and slash commands are never held back.
     */
    public static boolean shouldDebounce(InboundMessage message) {
        if (message.hasMedia() || message.edited()) {
            return false;
        }
        return !message.body().stripLeading().startsWith("/");
    }

    /**
     * Per-provider window from {@code messages.inbound.byChannel}, else
     * {@code messages.inbound.debounceMs}, else 0.
     */
    public static long resolveDebounceMs(UltronConfig.InboundConfig inbound, String provider) {
        if (inbound == null) {
            return 0;
        }
        if (inbound.getByChannel() != null && provider != null) {
            Long byChannel = inbound.getByChannel().get(provider.trim().toLowerCase(Locale.ROOT));
            if (byChannel == null) {
                byChannel = inbound.getByChannel().get(provider);
            }
            if (byChannel != null) {
                return Math.max(0, byChannel);
            }
        }
        return inbound.getDebounceMs() != null ? Math.max(0, inbound.getDebounceMs()) : 0;
    }

    private static String token(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }

    private static final class Buffer<T> {
        final List<T> items;
        final long generation;
        volatile ScheduledFuture<?> timer;

        Buffer(List<T> items, long generation) {
            this.items = items;
            this.generation = generation;
        }

        void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
