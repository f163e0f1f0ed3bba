package com.ultron.gateway.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSONL-based conversation transcript files.
 *
 * <p>
 * Line 1 is always a header:
 * </p>
 *
 * <pre>
 *   {"type":"session","version":1,"id":"...","sessionKey":"...","timestamp":"..."}
 * </pre>
 *
 * <p>
 * Subsequent lines are turns:
 * </p>
 *
 * <pre>
 *   {"type":"turn","role":"user","text":"hi","timestamp":1700000000000,...}
 * </pre>
 */
@Slf4j
public class TranscriptStore {

    static final int CURRENT_VERSION = 1;
    private static final String TYPE_SESSION = "session";
    private static final String TYPE_TURN = "turn";

    private final ObjectMapper mapper;

    public TranscriptStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TranscriptStore() {
        this(new ObjectMapper());
    }

    // =========================================================================
    // Write operations
    // =========================================================================

    /**
     * Create the file with its header if it does not exist yet.
     */
    public void ensureFile(Path path, String sessionId, String sessionKey) throws IOException {
        if (Files.exists(path)) {
            return;
        }
        Files.createDirectories(path.getParent());
        Files.writeString(path, headerLine(sessionId, sessionKey), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        log.debug("created transcript file: {}", path);
    }

    /**
     * Append one turn as a single line.
     */
    public void append(Path path, String sessionId, String sessionKey, TranscriptTurn turn) throws IOException {
        ensureFile(path, sessionId, sessionKey);
        Files.writeString(path, turnLine(turn), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        log.debug("appended {} turn to transcript: {}", turn.role().wireName(), path.getFileName());
    }

    /**
     * Replace the file contents with a fresh header and {@code turns}, via a
     * temp file and atomic rename.
     */
    public void rewrite(Path path, String sessionId, String sessionKey, List<TranscriptTurn> turns)
            throws IOException {
        Files.createDirectories(path.getParent());
        StringBuilder sb = new StringBuilder(headerLine(sessionId, sessionKey));
        for (TranscriptTurn turn : turns) {
            sb.append(turnLine(turn));
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(temp, sb.toString(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Move a transcript into the archive. Missing files are ignored.
     *
     * @return true if a file was moved
     */
    public boolean archive(Path path, Path archivedPath) throws IOException {
        if (!Files.exists(path)) {
            return false;
        }
        Files.createDirectories(archivedPath.getParent());
        Files.move(path, archivedPath, StandardCopyOption.REPLACE_EXISTING);
        log.debug("archived transcript {} -> {}", path.getFileName(), archivedPath.getFileName());
        return true;
    }

    /**
     * Copy a transcript into the archive, leaving the original in place.
     */
    public boolean copyTo(Path path, Path archivedPath) throws IOException {
        if (!Files.exists(path)) {
            return false;
        }
        Files.createDirectories(archivedPath.getParent());
        Files.copy(path, archivedPath, StandardCopyOption.REPLACE_EXISTING);
        return true;
    }

    // =========================================================================
    // Read operations
    // =========================================================================

    /**
     * Read all turns in file order. The header and corrupt lines are skipped.
     */
    public List<TranscriptTurn> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TranscriptTurn> turns = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty())
                    continue;
                try {
                    JsonNode node = mapper.readTree(line);
                    if (!TYPE_TURN.equals(node.path("type").asText())) {
                        continue;
                    }
                    ObjectNode fields = ((ObjectNode) node).deepCopy();
                    fields.remove("type");
                    turns.add(mapper.treeToValue(fields, TranscriptTurn.class));
                } catch (JsonProcessingException | IllegalArgumentException | ClassCastException e) {
                    log.warn("skipping malformed transcript line {} in {}: {}", lineNo, path.getFileName(),
                            e.getMessage());
                }
            }
        }
        return turns;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private String headerLine(String sessionId, String sessionKey) throws JsonProcessingException {
        ObjectNode header = mapper.createObjectNode();
        header.put("type", TYPE_SESSION);
        header.put("version", CURRENT_VERSION);
        header.put("id", sessionId);
        header.put("sessionKey", sessionKey);
        header.put("timestamp", Instant.now().toString());
        return mapper.writeValueAsString(header) + "\n";
    }

    private String turnLine(TranscriptTurn turn) throws JsonProcessingException {
        ObjectNode line = mapper.createObjectNode();
        line.put("type", TYPE_TURN);
        line.setAll((ObjectNode) mapper.valueToTree(turn));
        return mapper.writeValueAsString(line) + "\n";
    }
}
