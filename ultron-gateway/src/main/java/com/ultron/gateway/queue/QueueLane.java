package com.ultron.gateway.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Running and pending units of one lane. Every method is called with the
 * lane's monitor held.
 */
final class QueueLane {

    final String key;
    final boolean session;
    int capacity;
    final List<WorkUnit> running = new ArrayList<>();
    final Deque<WorkUnit> pending = new ArrayDeque<>();
    /** Set once the lane left the table; enqueuers must fetch a fresh one. */
    boolean retired;

    QueueLane(String key, int capacity) {
        this.key = key;
        this.session = Lanes.isSessionLane(key);
        this.capacity = capacity;
    }

    boolean hasWork() {
        return !running.isEmpty() || !pending.isEmpty();
    }

    WorkUnit firstRunning() {
        return running.isEmpty() ? null : running.get(0);
    }

    /**
     * Move pending units to running while capacity allows, FIFO.
     */
    List<WorkUnit> takeStartable() {
        List<WorkUnit> started = new ArrayList<>();
        while (running.size() < capacity && !pending.isEmpty()) {
            WorkUnit next = pending.pollFirst();
            running.add(next);
            started.add(next);
        }
        return started;
    }

    LaneSnapshot snapshot() {
        return new LaneSnapshot(key, capacity,
                running.stream().map(WorkUnit::getId).toList(),
                pending.stream().map(WorkUnit::getId).toList());
    }
}
