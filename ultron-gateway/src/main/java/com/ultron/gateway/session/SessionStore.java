package com.ultron.gateway.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ultron.common.config.AgentIds;
import com.ultron.common.config.SessionPaths;
import com.ultron.common.config.SessionReset;
import com.ultron.common.config.UltronConfig;
import com.ultron.common.infra.RetryRunner;
import com.ultron.gateway.agent.TokenUsage;
import com.ultron.gateway.routing.SessionKeys;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Durable per-session transcripts plus the per-agent session index.
 *
 * <p>
 * File layout:
 * </p>
 *
 * <pre>
 *   {stateDir}/agents/{agentId}/sessions/sessions.json
 *   {stateDir}/agents/{agentId}/sessions/{sessionId}.jsonl
 *   {stateDir}/agents/{agentId}/sessions/archive/
 * </pre>
 *
 * <p>
 * {@code cron:} and {@code hook:} keys live under the {@code default} agent
 * directory. Index mutations lock the owning {@link SessionIndex}; transcript
 * appends are only issued from inside the session's lane. All file IO is
 * retried and surfaces as {@link SessionStoreException} once retries are
 * exhausted.
 * </p>
 */
@Slf4j
public class SessionStore {

    private final Path stateDir;
    private final ObjectMapper mapper;
    private final TranscriptStore transcripts;
    private final RetryRunner retry;
    private final ZoneId zone;
    private final LongSupplier clock;
    private final Map<Path, SessionIndex> indexes = new ConcurrentHashMap<>();
    private volatile UltronConfig.SessionConfig sessionConfig;

    public SessionStore(Path stateDir,
            UltronConfig.SessionConfig sessionConfig,
            ObjectMapper mapper,
            RetryRunner retry,
            ZoneId zone,
            LongSupplier clock) {
        this.stateDir = stateDir;
        this.sessionConfig = sessionConfig != null ? sessionConfig : new UltronConfig.SessionConfig();
        this.mapper = mapper != null ? mapper : new ObjectMapper();
        this.transcripts = new TranscriptStore(this.mapper);
        this.retry = retry != null ? retry
                : new RetryRunner(RetryRunner.Config.FILE_IO, null,
                        info -> log.warn("session store {} failed (attempt {}/{}), retrying in {}ms: {}",
                                info.label(), info.attempt(), info.maxAttempts(), info.delayMs(),
                                info.err().getMessage()));
        this.zone = zone != null ? zone : ZoneId.systemDefault();
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    public SessionStore(Path stateDir, UltronConfig.SessionConfig sessionConfig) {
        this(stateDir, sessionConfig, null, null, null, null);
    }

    // =========================================================================
    // Startup / config
    // =========================================================================

    /**
     * Load every agent's {@code sessions.json} under the state directory.
     *
     * @return number of records loaded
     */
    public int loadAll() {
        Path agentsDir = stateDir.resolve("agents");
        List<Path> sessionDirs = new ArrayList<>();
        if (Files.isDirectory(agentsDir)) {
            try (Stream<Path> dirs = Files.list(agentsDir)) {
                dirs.filter(Files::isDirectory)
                        .map(dir -> sessionsDir(dir.getFileName().toString()))
                        .forEach(sessionDirs::add);
            } catch (IOException e) {
                throw new SessionStoreException("listing " + agentsDir + " failed", e);
            }
        }
        int total = 0;
        for (Path dir : sessionDirs) {
            total += indexFor(dir).size();
        }
        log.info("loaded {} sessions from {}", total, agentsDir);
        return total;
    }

    /** Swap reset, pruning and store settings on config reload. */
    public void applyConfig(UltronConfig.SessionConfig config) {
        this.sessionConfig = config != null ? config : new UltronConfig.SessionConfig();
    }

    public PruningPolicy pruningPolicy() {
        return PruningPolicy.fromConfig(sessionConfig.getPruning());
    }

    // =========================================================================
    // Index
    // =========================================================================

    /**
     * Index entry for {@code sessionKey}, created if unknown.
     */
    public SessionRecord index(String sessionKey) {
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            return ensureRecord(idx, sessionKey, clock.getAsLong()).copy();
        }
    }

    public Optional<SessionRecord> find(String sessionKey) {
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            return idx.get(sessionKey).map(SessionRecord::copy);
        }
    }

    public List<SessionRecord> list() {
        List<SessionRecord> all = new ArrayList<>();
        for (SessionIndex idx : indexes.values()) {
            all.addAll(idx.snapshot());
        }
        return all;
    }

    /**
     * Mutate an existing record and persist it.
     *
     * @return false if the key has no record
     */
    public boolean updateRecord(String sessionKey, Consumer<SessionRecord> updater) {
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            Optional<SessionRecord> record = idx.get(sessionKey);
            if (record.isEmpty()) {
                return false;
            }
            updater.accept(record.get());
            io("save index", () -> {
                idx.save();
                return null;
            });
            return true;
        }
    }

    // =========================================================================
    // Transcript
    // =========================================================================

    /**
     * Stored transcript of {@code sessionKey}; unknown keys get a fresh,
     * empty session.
     */
    public Transcript load(String sessionKey) {
        SessionRecord record = index(sessionKey);
        Path path = transcriptPath(record);
        List<TranscriptTurn> turns = io("read transcript", () -> transcripts.read(path));
        return new Transcript(record.getSessionId(), sessionKey, turns);
    }

    /**
     * Append one turn. Only called from inside the session's lane.
     */
    public void append(String sessionKey, TranscriptTurn turn) {
        SessionRecord record = index(sessionKey);
        Path path = transcriptPath(record);
        io("append transcript", () -> {
            transcripts.append(path, record.getSessionId(), sessionKey, turn);
            return null;
        });
    }

    /**
     * Pruned view of the stored transcript; storage is untouched.
     */
    public TranscriptView buildView(String sessionKey, PruningPolicy policy) {
        return TranscriptPruner.prune(load(sessionKey), policy);
    }

    public TranscriptView buildView(String sessionKey) {
        return buildView(sessionKey, pruningPolicy());
    }

    /**
     * Rewrite the transcript with its pruned view after copying the previous
     * file into the archive.
     */
    public TranscriptView compact(String sessionKey, PruningPolicy policy) {
        TranscriptView view = buildView(sessionKey, policy);
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            SessionRecord record = ensureRecord(idx, sessionKey, clock.getAsLong());
            Path path = transcriptPath(record);
            long now = clock.getAsLong();
            io("compact transcript", () -> {
                transcripts.copyTo(path, SessionPaths.resolveCompactedTranscriptPath(
                        idx.getSessionsDir(), record.getSessionId(), now));
                transcripts.rewrite(path, record.getSessionId(), sessionKey, view.turns());
                return null;
            });
            record.setCompactionCount(record.getCompactionCount() + 1);
            record.setUpdatedAt(now);
            saveIndex(idx);
        }
        log.info("compacted session {}: {} -> {} turns", sessionKey, view.totalTurns(), view.turns().size());
        return view;
    }

    // =========================================================================
    // Runs
    // =========================================================================

    /**
     * Prepare a session for a run: apply the reset policy, create the record
     * if needed and stamp origin metadata.
     */
    public SessionResolution resolveForRun(String sessionKey, SessionOrigin origin, long now) {
        SessionOrigin o = origin != null ? origin : SessionOrigin.NONE;
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            SessionRecord existing = idx.get(sessionKey).orElse(null);
            String resetReason = null;
            if (existing != null) {
                SessionReset.SessionFreshness freshness = evaluateFreshness(existing, o, now);
                if (!freshness.fresh()) {
                    resetReason = freshness.staleReason();
                    archiveLocked(idx, existing, resetReason, now);
                    existing = null;
                }
            }

            boolean isNew = existing == null || existing.getRunCount() == 0;
            SessionRecord record = existing != null ? existing : ensureRecord(idx, sessionKey, now);
            stampOrigin(record, o);
            record.setUpdatedAt(now);
            saveIndex(idx);

            if (resetReason != null) {
                log.info("session {} reset ({}), new session {}", sessionKey, resetReason, record.getSessionId());
            }
            return new SessionResolution(record.copy(), isNew, resetReason);
        }
    }

    /**
     * Record a completed run: usage, snippets and {@code updatedAt}.
     */
    public SessionRecord recordRun(String sessionKey, TokenUsage usage, String lastMessage, String lastReply) {
        TokenUsage u = usage != null ? usage : TokenUsage.ZERO;
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            SessionRecord record = ensureRecord(idx, sessionKey, clock.getAsLong());
            record.setInputTokens(record.getInputTokens() + u.inputTokens());
            record.setOutputTokens(record.getOutputTokens() + u.outputTokens());
            record.setTotalTokens(record.getTotalTokens() + u.totalTokens());
            if (lastMessage != null) {
                record.setLastMessage(SessionRecord.snippet(lastMessage));
            }
            if (lastReply != null) {
                record.setLastReply(SessionRecord.snippet(lastReply));
            }
            record.setRunCount(record.getRunCount() + 1);
            record.setUpdatedAt(clock.getAsLong());
            saveIndex(idx);
            return record.copy();
        }
    }

    // =========================================================================
    // Reset
    // =========================================================================

    /**
     * Archive the transcript and final record, then drop the index entry.
     *
     * @return the archived record, empty if the key was unknown
     */
    public Optional<SessionRecord> reset(String sessionKey, String reason) {
        SessionIndex idx = indexForKey(sessionKey);
        synchronized (idx) {
            Optional<SessionRecord> existing = idx.get(sessionKey);
            if (existing.isEmpty()) {
                return Optional.empty();
            }
            SessionRecord archived = existing.get().copy();
            archiveLocked(idx, existing.get(), reason, clock.getAsLong());
            saveIndex(idx);
            log.info("session {} reset ({})", sessionKey, reason);
            return Optional.of(archived);
        }
    }

    /**
     * Reset every stale session whose lane is idle.
     *
     * @return keys that were reset
     */
    public List<String> sweepStale(long now, Predicate<String> isIdle) {
        List<String> resetKeys = new ArrayList<>();
        for (SessionIndex idx : indexes.values()) {
            synchronized (idx) {
                boolean changed = false;
                for (SessionRecord record : idx.snapshot()) {
                    if (!isIdle.test(record.getSessionKey())) {
                        continue;
                    }
                    SessionReset.SessionFreshness freshness = evaluateFreshness(record, SessionOrigin.NONE, now);
                    if (freshness.fresh()) {
                        continue;
                    }
                    archiveLocked(idx, record, freshness.staleReason(), now);
                    resetKeys.add(record.getSessionKey());
                    changed = true;
                }
                if (changed) {
                    saveIndex(idx);
                }
            }
        }
        if (!resetKeys.isEmpty()) {
            log.info("reset {} stale sessions", resetKeys.size());
        }
        return resetKeys;
    }

    /**
     * Freshness of a record under the policy for its type and channel.
     */
    public SessionReset.SessionFreshness evaluateFreshness(SessionRecord record, SessionOrigin origin, long now) {
        UltronConfig.SessionConfig cfg = sessionConfig;
        boolean isGroup = origin.chatType() != null ? origin.isGroup()
                : record.getChatType() != null && !"dm".equals(record.getChatType());
        boolean isThread = origin.isThread() || "thread".equals(record.getChatType());
        SessionReset.SessionResetType type = SessionReset.resolveSessionResetType(
                record.getSessionKey(), isGroup, isThread);
        String channel = origin.channel() != null ? origin.channel() : record.getChannel();
        SessionReset.SessionResetPolicy policy = SessionReset.resolveSessionResetPolicy(
                cfg, type, SessionReset.resolveChannelResetConfig(cfg, channel));
        return SessionReset.evaluateSessionFreshness(record.getUpdatedAt(), now, policy, zone);
    }

    public Path transcriptPath(SessionRecord record) {
        Path dir = sessionsDir(record.getAgentId());
        String file = record.getTranscriptFile() != null
                ? record.getTranscriptFile()
                : record.getSessionId() + ".jsonl";
        return dir.resolve(file);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private void archiveLocked(SessionIndex idx, SessionRecord record, String reason, long now) {
        Path path = transcriptPath(record);
        Path archivedPath = SessionPaths.resolveArchivedTranscriptPath(idx.getSessionsDir(),
                record.getSessionId(), now);
        io("archive session", () -> {
            transcripts.archive(path, archivedPath);
            idx.appendArchive(record, reason, now);
            return null;
        });
        idx.remove(record.getSessionKey());
    }

    private SessionRecord ensureRecord(SessionIndex idx, String sessionKey, long now) {
        Optional<SessionRecord> existing = idx.get(sessionKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        String sessionId = UUID.randomUUID().toString();
        SessionRecord record = SessionRecord.builder()
                .sessionId(sessionId)
                .sessionKey(sessionKey)
                .agentId(agentIdFor(sessionKey))
                .createdAt(now)
                .updatedAt(now)
                .context(new LinkedHashMap<>())
                .transcriptFile(sessionId + ".jsonl")
                .build();
        idx.put(record);
        saveIndex(idx);
        log.debug("session created: {} (key={})", sessionId, sessionKey);
        return record;
    }

    private static void stampOrigin(SessionRecord record, SessionOrigin origin) {
        if (origin.channel() != null) {
            record.setChannel(origin.channel());
            record.setAccountId(origin.accountId());
            record.setChatType(origin.chatType());
            record.setPeerId(origin.peerId());
            record.setPeerName(origin.peerName());
            record.setGroupId(origin.groupId());
            record.setThreadId(origin.threadId());
        }
    }

    private void saveIndex(SessionIndex idx) {
        io("save index", () -> {
            idx.save();
            return null;
        });
    }

    private SessionIndex indexForKey(String sessionKey) {
        return indexFor(sessionsDir(agentIdFor(sessionKey)));
    }

    private SessionIndex indexFor(Path sessionsDir) {
        return indexes.computeIfAbsent(sessionsDir, dir -> {
            SessionIndex idx = new SessionIndex(dir, mapper);
            io("load index", idx::load);
            return idx;
        });
    }

    private Path sessionsDir(String agentId) {
        return SessionPaths.resolveAgentSessionsDir(stateDir, sessionConfig.getStore(), agentId);
    }

    static String agentIdFor(String sessionKey) {
        return SessionKeys.parseAgentId(sessionKey).orElse(AgentIds.DEFAULT_AGENT_ID);
    }

    private <T> T io(String label, Callable<T> op) {
        try {
            return retry.execute(op, label);
        } catch (SessionStoreException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionStoreException(label + " interrupted", e);
        } catch (Exception e) {
            throw new SessionStoreException(label + " failed: " + e.getMessage(), e);
        }
    }
}
