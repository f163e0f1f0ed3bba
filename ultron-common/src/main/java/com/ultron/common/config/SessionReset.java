package com.ultron.common.config;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Session reset policy resolution and freshness evaluation.
 */
public final class SessionReset {

    private SessionReset() {
    }

    // =========================================================================
    // Constants
    // =========================================================================

    public static final String MODE_DAILY = "daily";
    public static final String MODE_IDLE = "idle";

    public static final String DEFAULT_RESET_MODE = MODE_DAILY;
    public static final int DEFAULT_RESET_AT_HOUR = 4;
    public static final int DEFAULT_IDLE_MINUTES = 60;

    private static final List<String> THREAD_SESSION_MARKERS = List.of(":thread:", ":topic:");
    private static final List<String> GROUP_SESSION_MARKERS = List.of(":group:", ":channel:");

    // =========================================================================
    // Types
    // =========================================================================

    /** mode is "daily" or "idle"; idleMinutes may be null in daily mode. */
    public record SessionResetPolicy(String mode, int atHour, Integer idleMinutes) {
    }

    /**
     * Session freshness evaluation result. The timestamps are only set for the
     * boundary that made the session stale.
     */
    public record SessionFreshness(boolean fresh, Long dailyResetAt, Long idleExpiresAt) {

        /** "idle", "daily" or null when fresh. */
        public String staleReason() {
            if (fresh)
                return null;
            return idleExpiresAt != null ? MODE_IDLE : MODE_DAILY;
        }
    }

    public enum SessionResetType {
        DM, GROUP, THREAD
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Check whether a session key represents a thread session.
     */
    public static boolean isThreadSessionKey(String sessionKey) {
        String normalized = (sessionKey != null ? sessionKey : "").toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        return THREAD_SESSION_MARKERS.stream().anyMatch(normalized::contains);
    }

    /**
     * Resolve the reset type for a session from its key and chat flags.
     */
    public static SessionResetType resolveSessionResetType(
            String sessionKey, boolean isGroup, boolean isThread) {
        if (isThread || isThreadSessionKey(sessionKey)) {
            return SessionResetType.THREAD;
        }
        if (isGroup) {
            return SessionResetType.GROUP;
        }
        String normalized = (sessionKey != null ? sessionKey : "").toLowerCase(Locale.ROOT);
        if (GROUP_SESSION_MARKERS.stream().anyMatch(normalized::contains)) {
            return SessionResetType.GROUP;
        }
        return SessionResetType.DM;
    }

    /**
     * The most recent daily boundary at or before {@code now}, in the given
     * zone.
     */
    public static long resolveDailyResetAtMs(long now, int atHour, ZoneId zone) {
        int hour = normalizeResetAtHour(atHour);
        ZonedDateTime current = Instant.ofEpochMilli(now).atZone(zone);
        ZonedDateTime resetAt = current.toLocalDate().atTime(hour, 0).atZone(zone);
        if (current.isBefore(resetAt)) {
            resetAt = resetAt.minusDays(1);
        }
        return resetAt.toInstant().toEpochMilli();
    }

    /**
     * The next daily boundary strictly after {@code now}.
     */
    public static long resolveNextDailyResetAtMs(long now, int atHour, ZoneId zone) {
        long previous = resolveDailyResetAtMs(now, atHour, zone);
        return Instant.ofEpochMilli(previous).atZone(zone).plusDays(1).toInstant().toEpochMilli();
    }

    /**
     * Resolve the reset policy. Precedence: per-channel override, then
     * per-type, then the base {@code session.reset}.
     */
    public static SessionResetPolicy resolveSessionResetPolicy(
            UltronConfig.SessionConfig sessionCfg,
            SessionResetType resetType,
            UltronConfig.SessionResetConfig channelOverride) {

        UltronConfig.SessionResetConfig baseReset = sessionCfg != null ? sessionCfg.getReset() : null;

        UltronConfig.SessionResetConfig typeReset = null;
        if (sessionCfg != null && sessionCfg.getResetByType() != null) {
            typeReset = switch (resetType) {
                case DM -> sessionCfg.getResetByType().getDm();
                case GROUP -> sessionCfg.getResetByType().getGroup();
                case THREAD -> sessionCfg.getResetByType().getThread();
            };
        }

        String mode = firstNonBlank(
                channelOverride != null ? channelOverride.getMode() : null,
                typeReset != null ? typeReset.getMode() : null,
                baseReset != null ? baseReset.getMode() : null);
        mode = normalizeMode(mode);

        int atHour = normalizeResetAtHour(firstInt(
                channelOverride != null ? channelOverride.getAtHour() : null,
                typeReset != null ? typeReset.getAtHour() : null,
                baseReset != null ? baseReset.getAtHour() : null,
                DEFAULT_RESET_AT_HOUR));

        Integer idleMinutesRaw = firstInt(
                channelOverride != null ? channelOverride.getIdleMinutes() : null,
                typeReset != null ? typeReset.getIdleMinutes() : null,
                baseReset != null ? baseReset.getIdleMinutes() : null);

        Integer idleMinutes = null;
        if (idleMinutesRaw != null) {
            idleMinutes = Math.max(idleMinutesRaw, 1);
        } else if (MODE_IDLE.equals(mode)) {
            idleMinutes = DEFAULT_IDLE_MINUTES;
        }

        return new SessionResetPolicy(mode, atHour, idleMinutes);
    }

    /**
     * Resolve per-channel reset config.
     */
    public static UltronConfig.SessionResetConfig resolveChannelResetConfig(
            UltronConfig.SessionConfig sessionCfg, String channel) {
        if (sessionCfg == null || sessionCfg.getResetByChannel() == null || channel == null) {
            return null;
        }
        String key = channel.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return null;
        }
        var byChannel = sessionCfg.getResetByChannel();
        UltronConfig.SessionResetConfig result = byChannel.get(key);
        if (result == null) {
            result = byChannel.get(channel.trim());
        }
        return result;
    }

    /**
     * Evaluate whether a session last updated at {@code updatedAt} is still
     * fresh at {@code now}.
     */
    public static SessionFreshness evaluateSessionFreshness(
            long updatedAt, long now, SessionResetPolicy policy, ZoneId zone) {
        Long dailyResetAt = MODE_DAILY.equals(policy.mode())
                ? resolveDailyResetAtMs(now, policy.atHour(), zone)
                : null;
        Long idleExpiresAt = policy.idleMinutes() != null
                ? updatedAt + policy.idleMinutes() * 60_000L
                : null;
        boolean staleDaily = dailyResetAt != null && updatedAt < dailyResetAt;
        boolean staleIdle = idleExpiresAt != null && now > idleExpiresAt;
        return new SessionFreshness(!(staleDaily || staleIdle),
                staleDaily ? dailyResetAt : null,
                staleIdle ? idleExpiresAt : null);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    public static int normalizeResetAtHour(int value) {
        if (value < 0)
            return 0;
        if (value > 23)
            return 23;
        return value;
    }

    private static String normalizeMode(String mode) {
        if (mode == null) {
            return DEFAULT_RESET_MODE;
        }
        String lc = mode.trim().toLowerCase(Locale.ROOT);
        return MODE_IDLE.equals(lc) ? MODE_IDLE : MODE_DAILY;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static Integer firstInt(Integer... values) {
        for (Integer v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
