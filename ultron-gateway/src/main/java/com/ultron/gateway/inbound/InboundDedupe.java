package com.ultron.gateway.inbound;

import com.ultron.common.infra.DedupeCache;

import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Filters re-delivered inbound messages by {@code provider:messageId}.
 */
public class InboundDedupe {

    public static final long DEFAULT_TTL_MS = 5 * 60_000L;
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final DedupeCache cache;
    private final LongSupplier clock;

    public InboundDedupe(long ttlMs, int maxEntries, LongSupplier clock) {
        this.cache = new DedupeCache(ttlMs, maxEntries);
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    public InboundDedupe() {
        this(DEFAULT_TTL_MS, DEFAULT_MAX_ENTRIES, null);
    }

    /**
     * First observation of {@code (provider, messageId)} within the TTL
     * returns true. Messages without provider or id are always admitted.
     */
    public boolean admit(String provider, String messageId) {
        String key = buildKey(provider, messageId);
        if (key == null) {
            return true;
        }
        return cache.admit(key, clock.getAsLong());
    }

    public boolean admit(InboundMessage message) {
        return admit(message.provider(), message.dedupeId());
    }

    /**
     * Drop expired entries.
     *
     * @return number of entries removed
     */
    public int sweep() {
        return cache.sweep(clock.getAsLong());
    }

    public int size() {
        return cache.size();
    }

    static String buildKey(String provider, String messageId) {
        if (provider == null || provider.isBlank() || messageId == null || messageId.isBlank()) {
            return null;
        }
        return provider.trim().toLowerCase(Locale.ROOT) + ":" + messageId.trim();
    }
}
