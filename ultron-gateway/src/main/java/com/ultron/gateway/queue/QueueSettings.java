package com.ultron.gateway.queue;

import com.ultron.common.config.UltronConfig;

import java.util.Locale;

/**
 * Queue behaviour resolved for one enqueue.
 *
 * @param cap max pending units per lane
 */
public record QueueSettings(QueueMode mode, int cap, OverflowPolicy overflow) {

    public static final int DEFAULT_CAP = 20;

    public static final QueueSettings DEFAULT = new QueueSettings(QueueMode.DEFAULT, DEFAULT_CAP,
            OverflowPolicy.DEFAULT);

    public QueueSettings {
        mode = mode != null ? mode : QueueMode.DEFAULT;
        cap = cap > 0 ? cap : DEFAULT_CAP;
        overflow = overflow != null ? overflow : OverflowPolicy.DEFAULT;
    }

    public QueueSettings withMode(QueueMode newMode) {
        return new QueueSettings(newMode, cap, overflow);
    }

    /**
     * Resolve settings. Mode precedence: per-session override, then
     * {@code queue.byChannel[provider]}, then {@code queue.mode}.
     */
    public static QueueSettings resolve(UltronConfig.QueueConfig cfg, String provider, String sessionQueueMode) {
        String channel = provider != null ? provider.trim().toLowerCase(Locale.ROOT) : null;

        QueueMode channelMode = null;
        if (cfg != null && cfg.getByChannel() != null && channel != null) {
            channelMode = QueueMode.normalize(cfg.getByChannel().get(channel));
        }
        QueueMode sessionMode = QueueMode.normalize(sessionQueueMode);
        QueueMode cfgMode = cfg != null ? QueueMode.normalize(cfg.getMode()) : null;

        QueueMode mode = sessionMode != null ? sessionMode
                : channelMode != null ? channelMode
                        : cfgMode != null ? cfgMode
                                : QueueMode.DEFAULT;

        int cap = cfg != null && cfg.getCap() != null && cfg.getCap() > 0 ? cfg.getCap() : DEFAULT_CAP;
        OverflowPolicy overflow = cfg != null ? OverflowPolicy.normalize(cfg.getDrop()) : null;
        return new QueueSettings(mode, cap, overflow);
    }
}
