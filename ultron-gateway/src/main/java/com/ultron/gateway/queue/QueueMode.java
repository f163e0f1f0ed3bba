package com.ultron.gateway.queue;

import java.util.Locale;

/**
 * How a new unit is admitted to a session lane that already has work.
 */
public enum QueueMode {

    /** Merge into the newest pending unit. */
    COLLECT("collect"),
    /** Separate unit, run after the current one. */
    FOLLOWUP("followup"),
    /** Attach to the running unit's steering inbox. */
    STEER("steer"),
    /** Cancel the running unit and run next. */
    INTERRUPT("interrupt");

    public static final QueueMode DEFAULT = COLLECT;

    private final String configValue;

    QueueMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Normalize a raw mode string.
     *
     * @return canonical mode or {@code null} if unrecognized
     */
    public static QueueMode normalize(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "collect", "coalesce" -> COLLECT;
            case "followup", "follow-up", "followups" -> FOLLOWUP;
            case "steer", "steering" -> STEER;
            case "interrupt", "interrupts", "abort" -> INTERRUPT;
            default -> null;
        };
    }
}
