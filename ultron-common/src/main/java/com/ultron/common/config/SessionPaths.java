package com.ultron.common.config;

import java.nio.file.Path;

/**
 * Session file path resolution.
 *
 * <pre>
 *   {stateDir}/agents/{agentId}/sessions/sessions.json
 *   {stateDir}/agents/{agentId}/sessions/{sessionId}.jsonl
 *   {stateDir}/agents/{agentId}/sessions/archive/
 * </pre>
 */
public final class SessionPaths {

    private SessionPaths() {
    }

    public static final String INDEX_FILENAME = "sessions.json";
    public static final String ARCHIVE_DIRNAME = "archive";
    public static final String ARCHIVE_INDEX_FILENAME = "sessions-archive.jsonl";

    /**
     * Resolve the sessions directory for a given agent under a state dir.
     */
    public static Path resolveAgentSessionsDir(Path stateDir, String agentId) {
        String id = AgentIds.normalizeAgentId(agentId);
        return stateDir.resolve("agents").resolve(id).resolve("sessions");
    }

    /**
     * Resolve the sessions directory, honouring a {@code session.store}
     * override.
     */
    public static Path resolveAgentSessionsDir(Path stateDir, String store, String agentId) {
        String id = AgentIds.normalizeAgentId(agentId);
        if (store == null || store.isBlank()) {
            return resolveAgentSessionsDir(stateDir, id);
        }
        String expanded = store.replace("{agentId}", id);
        return ConfigPaths.resolveUserPath(expanded, System.getProperty("user.home"));
    }

    public static Path resolveIndexPath(Path sessionsDir) {
        return sessionsDir.resolve(INDEX_FILENAME);
    }

    public static Path resolveTranscriptPath(Path sessionsDir, String sessionId) {
        return sessionsDir.resolve(sessionId + ".jsonl");
    }

    public static Path resolveArchiveDir(Path sessionsDir) {
        return sessionsDir.resolve(ARCHIVE_DIRNAME);
    }

    /**
     * Archived transcript name: {@code <sessionId>.jsonl.reset.<timestampMs>}.
     */
    public static Path resolveArchivedTranscriptPath(Path sessionsDir, String sessionId, long timestampMs) {
        return resolveArchiveDir(sessionsDir).resolve(sessionId + ".jsonl.reset." + timestampMs);
    }

    /**
     * Pre-compaction copy: {@code <sessionId>.jsonl.compact.<timestampMs>}.
     */
    public static Path resolveCompactedTranscriptPath(Path sessionsDir, String sessionId, long timestampMs) {
        return resolveArchiveDir(sessionsDir).resolve(sessionId + ".jsonl.compact." + timestampMs);
    }
}
