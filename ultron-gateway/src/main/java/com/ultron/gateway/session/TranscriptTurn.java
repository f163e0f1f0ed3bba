package com.ultron.gateway.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ultron.gateway.inbound.InboundMessage;
import lombok.Builder;

import java.util.Map;

/**
 * One entry of a session transcript.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptTurn(
        TurnRole role,
        String text,
        long timestamp,
        String messageId,
        String senderId,
        String senderName,
        String toolName,
        Map<String, Object> metadata) {

    public static TranscriptTurn user(InboundMessage message) {
        return TranscriptTurn.builder()
                .role(TurnRole.USER)
                .text(message.body())
                .timestamp(message.timestamp())
                .messageId(message.messageId())
                .senderId(message.senderId())
                .senderName(message.senderName())
                .metadata(message.hasMedia() ? Map.of("media", message.media()) : null)
                .build();
    }

    public static TranscriptTurn user(String text, long timestamp) {
        return TranscriptTurn.builder().role(TurnRole.USER).text(text).timestamp(timestamp).build();
    }

    public static TranscriptTurn assistant(String text, long timestamp) {
        return TranscriptTurn.builder().role(TurnRole.ASSISTANT).text(text).timestamp(timestamp).build();
    }

    public static TranscriptTurn toolResult(String toolName, String text, long timestamp) {
        return TranscriptTurn.builder()
                .role(TurnRole.TOOL_RESULT)
                .toolName(toolName)
                .text(text)
                .timestamp(timestamp)
                .build();
    }
}
