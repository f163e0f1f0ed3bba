package com.ultron.gateway.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Index entry for one session key, persisted in {@code sessions.json}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionRecord {

    public static final int SNIPPET_MAX_CHARS = 200;

    private String sessionId;
    private String sessionKey;
    private String agentId;
    private long createdAt;
    private long updatedAt;

    // origin of the last message
    private String channel;
    private String accountId;
    private String chatType;
    private String peerId;
    private String peerName;
    private String groupId;
    private String threadId;

    // cumulative usage
    private long inputTokens;
    private long outputTokens;
    private long totalTokens;

    private String lastMessage;
    private String lastReply;
    private int runCount;
    /** Per-session queue mode override. */
    private String queueMode;
    private int compactionCount;
    private Map<String, Object> context;
    /** Transcript file name relative to the sessions directory. */
    private String transcriptFile;

    /**
     * Deep enough copy for handing out of the index.
     */
    public SessionRecord copy() {
        return toBuilder()
                .context(context != null ? new LinkedHashMap<>(context) : null)
                .build();
    }

    public static String snippet(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return trimmed.length() <= SNIPPET_MAX_CHARS ? trimmed : trimmed.substring(0, SNIPPET_MAX_CHARS);
    }
}
