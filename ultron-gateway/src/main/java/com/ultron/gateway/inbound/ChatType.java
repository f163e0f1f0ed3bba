package com.ultron.gateway.inbound;

import java.util.Locale;

/**
 * Conversation shape of an inbound message.
 */
public enum ChatType {
    DM,
    GROUP,
    CHANNEL,
    THREAD;

    /**
     * Lenient parse of provider chat-type strings. Unknown or blank values
     * are treated as direct messages.
     */
    public static ChatType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DM;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "group", "supergroup" -> GROUP;
            case "channel" -> CHANNEL;
            case "thread", "topic" -> THREAD;
            default -> DM;
        };
    }

    /** Group, channel and thread chats ignore the DM scope mode. */
    public boolean isGroupLike() {
        return this != DM;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
