package com.ultron.gateway.session;

import com.ultron.gateway.inbound.InboundMessage;

/**
 * Where the message that triggered a run came from; stamped onto the
 * session record.
 */
public record SessionOrigin(
        String channel,
        String accountId,
        String chatType,
        String peerId,
        String peerName,
        String groupId,
        String threadId) {

    public static final SessionOrigin NONE = new SessionOrigin(null, null, null, null, null, null, null);

    public static SessionOrigin from(InboundMessage message) {
        return new SessionOrigin(
                message.provider(),
                message.accountId(),
                message.chatType().token(),
                message.peerId(),
                message.peerName(),
                message.groupId(),
                message.threadId());
    }

    public boolean isGroup() {
        return chatType != null && !"dm".equals(chatType);
    }

    public boolean isThread() {
        return "thread".equals(chatType) || (threadId != null && !threadId.isBlank());
    }
}
