package com.ultron.gateway.session;

import com.ultron.common.config.UltronConfig;

/**
 * @param keepRecentTurns most recent conversational turns kept intact
 * @param maxTurns        target size of a view; the recent window is kept even when larger
 */
public record PruningPolicy(int keepRecentTurns, int maxTurns) {

    public static final int DEFAULT_KEEP_RECENT_TURNS = 10;
    public static final int DEFAULT_MAX_TURNS = 50;
    public static final PruningPolicy DEFAULT = new PruningPolicy(DEFAULT_KEEP_RECENT_TURNS, DEFAULT_MAX_TURNS);

    public PruningPolicy {
        keepRecentTurns = Math.max(0, keepRecentTurns);
        maxTurns = Math.max(1, maxTurns);
    }

    public static PruningPolicy fromConfig(UltronConfig.PruningConfig cfg) {
        if (cfg == null) {
            return DEFAULT;
        }
        return new PruningPolicy(
                cfg.getKeepRecentTurns() != null ? cfg.getKeepRecentTurns() : DEFAULT_KEEP_RECENT_TURNS,
                cfg.getMaxTurns() != null ? cfg.getMaxTurns() : DEFAULT_MAX_TURNS);
    }
}
