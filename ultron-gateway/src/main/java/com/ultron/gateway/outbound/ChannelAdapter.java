package com.ultron.gateway.outbound;

import com.ultron.gateway.inbound.InboundMessage;

import java.util.function.Consumer;

/**
 * Boundary to one messaging platform. Implementations own the wire protocol
 * and split replies that exceed {@link #maxMessageLength()}.
 */
public interface ChannelAdapter {

    /** Provider id, e.g. "telegram". */
    String provider();

    /** Start receiving; every normalized message goes to {@code sink}. */
    void start(Consumer<InboundMessage> sink);

    void stop();

    boolean isRunning();

    /**
     * Send one reply. Throwing, or returning a failed result marked
     * retryable, makes the caller retry.
     */
    DeliveryResult send(OutboundMessage message) throws Exception;

    /** Platform text limit; 0 means unlimited. */
    default int maxMessageLength() {
        return 0;
    }
}
