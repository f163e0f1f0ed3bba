package com.ultron.gateway.inbound;

import com.ultron.common.config.UltronConfig;
import com.ultron.common.logging.SubsystemLogger;
import com.ultron.gateway.runtime.RuntimeMetrics;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * First stage of the inbound path: drops deletes and duplicates, then
 * debounces per sender before handing ordered batches downstream.
 */
public class InboundPipeline {

    private static final SubsystemLogger log = SubsystemLogger.create("gateway/inbound");

    private final InboundDedupe dedupe;
    private final InboundDebouncer<InboundMessage> debouncer;
    private final RuntimeMetrics metrics;
    private volatile UltronConfig.InboundConfig inboundConfig;

    public InboundPipeline(InboundDedupe dedupe,
            UltronConfig.InboundConfig inboundConfig,
            RuntimeMetrics metrics,
            Consumer<List<InboundMessage>> batchHandler) {
        this.dedupe = dedupe;
        this.inboundConfig = inboundConfig;
        this.metrics = metrics;
        this.debouncer = new InboundDebouncer<>(batch -> {
            metrics.increment(RuntimeMetrics.Counter.BATCHES_FLUSHED);
            batchHandler.accept(batch);
        });
    }

    /**
     * Process one message from the ingest queue.
     */
    public void accept(InboundMessage message) {
        metrics.increment(RuntimeMetrics.Counter.MESSAGES_RECEIVED);
        if (message.deleted()) {
            log.debug("delete notification dropped", Map.of(
                    "provider", String.valueOf(message.provider()),
                    "messageId", String.valueOf(message.messageId())));
            return;
        }
        if (!dedupe.admit(message)) {
            metrics.increment(RuntimeMetrics.Counter.DUPLICATES_DROPPED);
            log.debug("duplicate dropped", Map.of(
                    "provider", String.valueOf(message.provider()),
                    "messageId", String.valueOf(message.dedupeId())));
            return;
        }

        long windowMs = InboundDebouncer.shouldDebounce(message)
                ? InboundDebouncer.resolveDebounceMs(inboundConfig, message.provider())
                : 0;
        debouncer.offer(InboundDebouncer.buildKey(message), message, windowMs);
    }

    /** Swap debounce settings on config reload. */
    public void applyConfig(UltronConfig.InboundConfig inbound) {
        this.inboundConfig = inbound;
    }

    public int sweepDedupe() {
        int removed = dedupe.sweep();
        if (removed > 0) {
            log.debug("dedupe sweep", Map.of("removed", removed, "remaining", dedupe.size()));
        }
        return removed;
    }

    public void flushAll() {
        debouncer.flushAll();
    }

    public void shutdown() {
        debouncer.shutdown();
    }
}
