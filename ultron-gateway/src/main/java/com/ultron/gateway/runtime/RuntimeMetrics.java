package com.ultron.gateway.runtime;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe runtime counters for the gateway.
 * Tracks inbound filtering, queue outcomes, agent runs and deliveries.
 *
 * <p>
 * All counters are non-blocking and suitable for high-concurrency use. One
 * instance is owned by the runtime and passed to every component that
 * reports.
 * </p>
 */
public class RuntimeMetrics {

    public enum Counter {
        MESSAGES_RECEIVED,
        INGEST_REJECTED,
        DUPLICATES_DROPPED,
        BATCHES_FLUSHED,
        ROUTING_FAILED,
        UNITS_ENQUEUED,
        UNITS_MERGED,
        UNITS_STEERED,
        UNITS_INTERRUPTED,
        OVERFLOW_DROPPED_OLD,
        OVERFLOW_DROPPED_NEW,
        OVERFLOW_SUMMARIZED,
        RUNS_COMPLETED,
        RUNS_FAILED,
        RUNS_CANCELLED,
        SESSIONS_RESET,
        DELIVERIES_SENT,
        DELIVERIES_FAILED
    }

    private final Map<Counter, LongAdder> counters = new EnumMap<>(Counter.class);

    // ── Agent runs ────────────────────────────────────────────────

    private final AtomicLong activeAgentRuns = new AtomicLong(0);
    private final AtomicLong lastAgentRunDurationMs = new AtomicLong(0);
    private final LongAdder totalAgentRunDurationMs = new LongAdder();

    public RuntimeMetrics() {
        for (Counter counter : Counter.values()) {
            counters.put(counter, new LongAdder());
        }
    }

    public void increment(Counter counter) {
        counters.get(counter).increment();
    }

    public long get(Counter counter) {
        return counters.get(counter).sum();
    }

    public void onAgentRunStart() {
        activeAgentRuns.incrementAndGet();
    }

    public void onAgentRunEnd(long durationMs) {
        activeAgentRuns.decrementAndGet();
        lastAgentRunDurationMs.set(durationMs);
        totalAgentRunDurationMs.add(durationMs);
    }

    public long getActiveAgentRuns() {
        return activeAgentRuns.get();
    }

    public long getAverageAgentRunDurationMs() {
        long total = get(Counter.RUNS_COMPLETED) + get(Counter.RUNS_FAILED) + get(Counter.RUNS_CANCELLED);
        return total > 0 ? totalAgentRunDurationMs.sum() / total : 0;
    }

    // ── Snapshot ───────────────────────────────────────────────────

    /**
     * Create a point-in-time snapshot of all counters.
     */
    public Snapshot snapshot() {
        Map<Counter, Long> values = new EnumMap<>(Counter.class);
        counters.forEach((counter, adder) -> values.put(counter, adder.sum()));
        return new Snapshot(values, activeAgentRuns.get(), getAverageAgentRunDurationMs(),
                lastAgentRunDurationMs.get());
    }

    /**
     * Immutable snapshot of runtime metrics at a point in time.
     */
    public record Snapshot(
            Map<Counter, Long> counters,
            long activeAgentRuns,
            long averageAgentRunDurationMs,
            long lastAgentRunDurationMs) {
    }
}
