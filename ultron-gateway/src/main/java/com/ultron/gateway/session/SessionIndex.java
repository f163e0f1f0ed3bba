package com.ultron.gateway.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ultron.common.config.SessionPaths;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-system backed session index for one agent.
 * Manages a {@code sessions.json} file that maps sessionKey → record, and the
 * append-only {@code archive/sessions-archive.jsonl}.
 *
 * <p>
 * Callers synchronize on the instance for read-modify-write sequences.
 * </p>
 */
@Slf4j
public class SessionIndex {

    private static final TypeReference<LinkedHashMap<String, SessionRecord>> INDEX_TYPE = new TypeReference<>() {
    };

    private final Path sessionsDir;
    private final ObjectMapper mapper;
    private final ObjectMapper prettyMapper;
    private final Map<String, SessionRecord> records = new LinkedHashMap<>();

    public SessionIndex(Path sessionsDir, ObjectMapper mapper) {
        this.sessionsDir = sessionsDir;
        this.mapper = mapper;
        this.prettyMapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getSessionsDir() {
        return sessionsDir;
    }

    // =========================================================================
    // Load / Save
    // =========================================================================

    /**
     * Replace in-memory records with the persisted index. A missing file is
     * an empty index.
     */
    public synchronized int load() throws IOException {
        Path indexPath = SessionPaths.resolveIndexPath(sessionsDir);
        records.clear();
        if (!Files.exists(indexPath)) {
            return 0;
        }
        String json = Files.readString(indexPath, StandardCharsets.UTF_8);
        if (!json.isBlank()) {
            Map<String, SessionRecord> loaded = mapper.readValue(json, INDEX_TYPE);
            records.putAll(loaded);
        }
        log.debug("loaded session index with {} entries from {}", records.size(), indexPath);
        return records.size();
    }

    /**
     * Write the index via temp file and atomic rename.
     */
    public synchronized void save() throws IOException {
        Path indexPath = SessionPaths.resolveIndexPath(sessionsDir);
        Files.createDirectories(sessionsDir);
        Path tempFile = indexPath.resolveSibling(indexPath.getFileName() + ".tmp");
        Files.writeString(tempFile, prettyMapper.writeValueAsString(records), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        Files.move(tempFile, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("saved session index with {} entries to {}", records.size(), indexPath);
    }

    // =========================================================================
    // Records
    // =========================================================================

    public synchronized Optional<SessionRecord> get(String sessionKey) {
        return Optional.ofNullable(records.get(sessionKey));
    }

    public synchronized void put(SessionRecord record) {
        records.put(record.getSessionKey(), record);
    }

    public synchronized SessionRecord remove(String sessionKey) {
        return records.remove(sessionKey);
    }

    public synchronized List<SessionRecord> snapshot() {
        List<SessionRecord> copies = new ArrayList<>(records.size());
        for (SessionRecord record : records.values()) {
            copies.add(record.copy());
        }
        return copies;
    }

    public synchronized int size() {
        return records.size();
    }

    // =========================================================================
    // Archive
    // =========================================================================

    /**
     * Append the final state of a record to {@code sessions-archive.jsonl}.
     */
    public void appendArchive(SessionRecord record, String reason, long archivedAt) throws IOException {
        Path archiveIndex = SessionPaths.resolveArchiveDir(sessionsDir)
                .resolve(SessionPaths.ARCHIVE_INDEX_FILENAME);
        Files.createDirectories(archiveIndex.getParent());
        ObjectNode line = mapper.createObjectNode();
        line.put("archivedAt", archivedAt);
        line.put("reason", reason);
        line.set("record", mapper.valueToTree(record));
        Files.writeString(archiveIndex, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
