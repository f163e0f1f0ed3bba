package com.ultron.gateway.queue;

import java.util.Locale;

/**
 * What happens when a lane's pending count would exceed the cap.
 */
public enum OverflowPolicy {

    DROP_OLD("drop-old"),
    DROP_NEW("drop-new"),
    SUMMARIZE("summarize");

    public static final OverflowPolicy DEFAULT = SUMMARIZE;

    private final String configValue;

    OverflowPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Normalize a raw drop policy string.
     *
     * @return canonical policy or {@code null} if unrecognized
     */
    public static OverflowPolicy normalize(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "drop-old", "old", "oldest" -> DROP_OLD;
            case "drop-new", "new", "newest" -> DROP_NEW;
            case "summarize", "summary" -> SUMMARIZE;
            default -> null;
        };
    }
}
