package com.ultron.gateway.routing;

import java.util.Locale;

/**
 * How direct-message sessions collapse or separate.
 */
public enum SessionScope {
    MAIN("main"),
    PER_PEER("per-peer"),
    PER_CHANNEL_PEER("per-channel-peer"),
    PER_ACCOUNT_CHANNEL_PEER("per-account-channel-peer");

    private final String configValue;

    SessionScope(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Parse a config value; blank or unknown values fall back to
     * {@link #MAIN}.
     */
    public static SessionScope parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MAIN;
        }
        String cleaned = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SessionScope scope : values()) {
            if (scope.configValue.equals(cleaned)) {
                return scope;
            }
        }
        return MAIN;
    }
}
