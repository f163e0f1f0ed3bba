package com.ultron.gateway.session;

/**
 * Result of preparing a session for a run.
 *
 * @param resetReason "idle" or "daily" when a stale session was archived,
 *                    else null
 */
public record SessionResolution(SessionRecord record, boolean isNewSession, String resetReason) {
}
