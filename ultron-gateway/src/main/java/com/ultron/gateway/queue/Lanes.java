package com.ultron.gateway.queue;

import java.util.Locale;
import java.util.Map;

/**
 * Lane key resolution and default capacities.
 */
public final class Lanes {

    private Lanes() {
    }

    public static final String SESSION_PREFIX = "session:";

    public static final String MAIN = "main";
    public static final String CRON = "cron";
    public static final String HOOK = "hook";

    public static final int SESSION_CAPACITY = 1;
    public static final int UNKNOWN_LANE_CAPACITY = 1;

    public static final Map<String, Integer> DEFAULT_CAPACITIES = Map.of(
            MAIN, 4,
            CRON, 1,
            HOOK, 2);

    /**
     * Session-scoped lane for a session key.
     */
    public static String sessionLane(String sessionKey) {
        String cleaned = (sessionKey == null || sessionKey.isBlank()) ? MAIN : sessionKey.trim();
        return cleaned.startsWith(SESSION_PREFIX) ? cleaned : SESSION_PREFIX + cleaned;
    }

    /**
     * Global lane name, falling back to {@link #MAIN}.
     */
    public static String globalLane(String lane) {
        String cleaned = lane == null ? null : lane.trim().toLowerCase(Locale.ROOT);
        return (cleaned == null || cleaned.isEmpty()) ? MAIN : cleaned;
    }

    public static boolean isSessionLane(String laneKey) {
        return laneKey != null && laneKey.startsWith(SESSION_PREFIX);
    }

    /**
     * Capacity of a lane: fixed 1 for session lanes, configured or default
     * for global ones.
     */
    public static int capacityFor(String laneKey, Map<String, Integer> configured) {
        if (isSessionLane(laneKey)) {
            return SESSION_CAPACITY;
        }
        Integer value = configured != null ? configured.get(laneKey) : null;
        if (value == null) {
            value = DEFAULT_CAPACITIES.get(laneKey);
        }
        return value != null && value > 0 ? value : UNKNOWN_LANE_CAPACITY;
    }
}
