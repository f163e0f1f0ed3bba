package com.ultron.gateway.inbound;

import lombok.Builder;

import java.util.List;

/**
 * A normalized message received from a channel adapter.
 *
 * @param provider  channel name, e.g. {@code telegram}
 * @param accountId bot/account id on the provider, may be null
 * @param peerId    DM counterpart, or the group/channel id for group chats
 * @param groupId   guild/team/workspace id, may be null
 * @param threadId  thread or topic id, may be null
 * @param messageId provider-assigned id, may be null
 * @param timestamp epoch millis
 */
@Builder(toBuilder = true)
public record InboundMessage(
        String provider,
        String accountId,
        String peerId,
        String peerName,
        String senderId,
        String senderName,
        String body,
        ChatType chatType,
        String groupId,
        String threadId,
        String replyToId,
        List<String> media,
        String messageId,
        long timestamp,
        boolean edited,
        boolean deleted) {

    public InboundMessage {
        chatType = chatType != null ? chatType : ChatType.DM;
        media = media != null ? List.copyOf(media) : List.of();
        body = body != null ? body : "";
    }

    public boolean hasMedia() {
        return !media.isEmpty();
    }

    /**
     * Identity used for duplicate detection. Each edit of a message is a
     * distinct identity.
     */
    public String dedupeId() {
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        return edited ? messageId + ":edit:" + timestamp : messageId;
    }

    /** Sender label for logs and summaries. */
    public String senderLabel() {
        if (senderName != null && !senderName.isBlank()) {
            return senderName;
        }
        return senderId != null ? senderId : "unknown";
    }
}
