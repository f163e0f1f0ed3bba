package com.ultron.gateway.outbound;

import com.ultron.gateway.inbound.InboundMessage;
import lombok.Builder;

import java.util.List;

/**
 * One reply addressed to a conversation on a provider.
 *
 * @param target peer or group/channel id to send to
 */
@Builder
public record OutboundMessage(
        String provider,
        String accountId,
        String target,
        String text,
        List<String> media,
        String threadId,
        String replyToId) {

    public OutboundMessage {
        media = media != null ? List.copyOf(media) : List.of();
    }

    /**
     * Reply to the conversation {@code source} came from.
     */

    public static OutboundMessage replyTo(InboundMessage source, String text) {
        return OutboundMessage.builder()
                .provider(source.provider())
                .accountId(source.accountId())
                .target(source.peerId())
                .text(text)
                .threadId(source.threadId())
                .replyToId(source.messageId())
                .build();
    }
}
