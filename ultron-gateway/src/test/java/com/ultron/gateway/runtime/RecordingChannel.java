package com.ultron.gateway.runtime;

import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.outbound.ChannelAdapter;
import com.ultron.gateway.outbound.DeliveryResult;
import com.ultron.gateway.outbound.OutboundMessage;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * In-memory channel: records sends and lets tests push inbound messages.
 */
class RecordingChannel implements ChannelAdapter {

    final BlockingQueue<OutboundMessage> sent = new LinkedBlockingQueue<>();
    private volatile Consumer<InboundMessage> sink;
    private volatile boolean running;

    @Override
    public String provider() {
        return "test";
    }

    @Override
    public void start(Consumer<InboundMessage> sink) {
        this.sink = sink;
        this.running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public DeliveryResult send(OutboundMessage message) {
        sent.add(message);
        return DeliveryResult.sent(provider(), "out-" + sent.size());
    }

    void receive(InboundMessage message) {
        sink.accept(message);
    }

    static InboundMessage message(String peer, String id, String body) {
        return InboundMessage.builder()
                .provider("test")
                .peerId(peer)
                .senderId(peer)
                .messageId(id)
                .body(body)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
