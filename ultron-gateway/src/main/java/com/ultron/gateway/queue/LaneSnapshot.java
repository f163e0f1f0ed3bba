package com.ultron.gateway.queue;

import java.util.List;

/**
 * Point-in-time view of one lane.
 */
public record LaneSnapshot(String laneKey, int capacity, List<String> runningIds, List<String> pendingIds) {

    public LaneSnapshot {
        runningIds = List.copyOf(runningIds);
        pendingIds = List.copyOf(pendingIds);
    }

    public boolean isIdle() {
        return runningIds.isEmpty() && pendingIds.isEmpty();
    }
}
