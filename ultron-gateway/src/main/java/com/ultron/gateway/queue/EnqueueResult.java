package com.ultron.gateway.queue;

import java.util.List;

/**
 * What {@link QueueManager#enqueue} did with a unit.
 *
 * @param unit    the unit that will carry the messages (the incoming one, the
 *                merge target, the running unit for steer, or the synthetic
 *                summary unit)
 * @param dropped units completed as {@code DROPPED} by this call
 */
public record EnqueueResult(Outcome outcome, WorkUnit unit, List<WorkUnit> dropped) {

    public enum Outcome {
        /** Started immediately. */
        STARTED,
        /** Waiting in the lane. */
        QUEUED,
        /** Merged into a pending unit. */
        MERGED,
        /** Attached to the running unit's steering inbox. */
        STEERED,
        /** Running unit cancelled, incoming unit at the head. */
        INTERRUPTED,
        /** Pending units collapsed into one synthetic unit. */
        SUMMARIZED,
        /** Incoming unit dropped (overflow or shutdown). */
        REJECTED
    }

    public EnqueueResult {
        dropped = dropped != null ? List.copyOf(dropped) : List.of();
    }

    public boolean accepted() {
        return outcome != Outcome.REJECTED;
    }
}
