package com.ultron.gateway.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of sending one outbound message.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryResult {

    private String provider;

    private boolean success;

    /** Platform message id on success. */
    private String messageId;

    /** Failure description. */
    private String error;

    /** A failed send worth another attempt. */
    private boolean retryable;

    private int attempts;

    private Long timestamp;

    public static DeliveryResult sent(String provider, String messageId) {
        return DeliveryResult.builder()
                .provider(provider)
                .success(true)
                .messageId(messageId)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static DeliveryResult failed(String provider, String error, boolean retryable) {
        return DeliveryResult.builder()
                .provider(provider)
                .success(false)
                .error(error)
                .retryable(retryable)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
