package com.ultron.common.infra;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time-based deduplication cache with TTL and max-size eviction.
 * <p>
 * An admitted key stays blocked until its expiry; seeing it again does not
 * push the expiry out. Thread-safe via synchronization.
 */
public class DedupeCache {

    private final long ttlMs;
    private final int maxSize;
    // insertion order, oldest first
    private final LinkedHashMap<String, Long> expiries = new LinkedHashMap<>(64, 0.75f, false);

    public DedupeCache(long ttlMs, int maxSize) {
        this.ttlMs = Math.max(1, ttlMs);
        this.maxSize = Math.max(1, maxSize);
    }

    /**
     * Admit a key. Returns {@code true} on first observation (recording its
     * expiry) and {@code false} for a repeat within the TTL.
     */
    public synchronized boolean admit(String key) {
        return admit(key, System.currentTimeMillis());
    }

    /**
     * Admit with an explicit timestamp (useful for testing).
     */
    public synchronized boolean admit(String key, long nowMs) {
        if (key == null || key.isEmpty()) {
            return true;
        }

        Long expiresAt = expiries.get(key);
        if (expiresAt != null) {
            if (nowMs < expiresAt) {
                return false;
            }
            expiries.remove(key);
        }

        expiries.put(key, nowMs + ttlMs);
        enforceMaxSize();
        return true;
    }

    /**
     * Whether a key is currently blocked, without recording anything.
     */
    public synchronized boolean contains(String key, long nowMs) {
        Long expiresAt = key != null ? expiries.get(key) : null;
        return expiresAt != null && nowMs < expiresAt;
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public synchronized int sweep(long nowMs) {
        int removed = 0;
        Iterator<Map.Entry<String, Long>> it = expiries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() <= nowMs) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private void enforceMaxSize() {
        Iterator<Map.Entry<String, Long>> it = expiries.entrySet().iterator();
        while (expiries.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    public synchronized void clear() {
        expiries.clear();
    }

    public synchronized int size() {
        return expiries.size();
    }

    public long getTtlMs() {
        return ttlMs;
    }
}
