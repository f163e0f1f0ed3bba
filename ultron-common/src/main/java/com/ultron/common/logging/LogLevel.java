package com.ultron.common.logging;

import java.util.Locale;
import java.util.Map;

/**
 * Log level enumeration for {@code logging.level}.
 * Provides normalization and SLF4J level mapping.
 */
public enum LogLevel {
    SILENT,
    FATAL,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("fatal", FATAL),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase(Locale.ROOT));
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Convert to SLF4J level string for Logback configuration.
     */
    public String toSlf4jLevel() {
        return switch (this) {
            case SILENT -> "OFF";
            case FATAL -> "ERROR";
            default -> name();
        };
    }
}
