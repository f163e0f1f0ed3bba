package com.ultron.gateway.outbound;

import com.ultron.common.infra.RetryRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends replies through registered channel adapters, retrying transient
 * failures.
 */
@Slf4j
public class OutboundDelivery {

    private final Map<String, ChannelAdapter> adapters = new ConcurrentHashMap<>();
    private final RetryRunner.Config retryConfig;
    private final RetryRunner.Sleeper sleeper;

    public OutboundDelivery() {
        this(RetryRunner.Config.DELIVERY, null);
    }

    public OutboundDelivery(RetryRunner.Config retryConfig, RetryRunner.Sleeper sleeper) {
        this.retryConfig = retryConfig != null ? retryConfig : RetryRunner.Config.DELIVERY;
        this.sleeper = sleeper;
    }

    public void register(ChannelAdapter adapter) {
        adapters.put(adapter.provider().toLowerCase(Locale.ROOT), adapter);
        log.debug("registered channel adapter: {}", adapter.provider());
    }

    public void unregister(String provider) {
        if (provider != null) {
            adapters.remove(provider.toLowerCase(Locale.ROOT));
        }
    }

    public Optional<ChannelAdapter> getAdapter(String provider) {
        return Optional.ofNullable(adapters.get(provider != null ? provider.toLowerCase(Locale.ROOT) : ""));
    }

    public Collection<ChannelAdapter> getAdapters() {
        return Collections.unmodifiableCollection(adapters.values());
    }

    public Set<String> getRegisteredProviders() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    /**
     * Send with bounded retry. Never throws; a final failure is logged at
     * warn and returned.
     */
    public DeliveryResult deliver(OutboundMessage message) {
        Optional<ChannelAdapter> adapterOpt = getAdapter(message.provider());
        if (adapterOpt.isEmpty()) {
            log.warn("no channel adapter registered for provider: {}", message.provider());
            return DeliveryResult.failed(message.provider(), "no adapter for provider", false);
        }
        ChannelAdapter adapter = adapterOpt.get();
        AtomicInteger attempts = new AtomicInteger();
        RetryRunner retry = new RetryRunner(retryConfig,
                (err, attempt) -> isTransient(err),
                info -> log.debug("delivery to {}:{} failed (attempt {}/{}), retrying in {}ms",
                        message.provider(), message.target(), info.attempt(), info.maxAttempts(), info.delayMs()),
                sleeper);

        DeliveryResult result;
        try {
            result = retry.execute(() -> {
                attempts.incrementAndGet();
                DeliveryResult r = adapter.send(message);
                if (r == null) {
                    throw new IllegalStateException("adapter returned no result");
                }
                if (!r.isSuccess() && r.isRetryable()) {
                    throw new TransientDeliveryException(r);
                }
                return r;
            }, "deliver:" + message.provider());
        } catch (TransientDeliveryException e) {
            result = e.getResult();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = DeliveryResult.failed(message.provider(), "interrupted", false);
        } catch (Exception e) {
            result = DeliveryResult.failed(message.provider(), String.valueOf(e.getMessage()), isTransient(e));
        }
        result.setAttempts(attempts.get());

        if (result.isSuccess()) {
            log.debug("delivered reply to {}:{} ({})", message.provider(), message.target(), result.getMessageId());
        } else {
            log.warn("delivery to {}:{} failed after {} attempt(s): {}",
                    message.provider(), message.target(), result.getAttempts(), result);
        }
        return result;
    }

    private static boolean isTransient(Throwable err) {
        return err instanceof TransientDeliveryException
                || err instanceof IOException
                || err instanceof UncheckedIOException;
    }

    /**
     * Carries a retryable failed result through the retry loop.
     */
    static class TransientDeliveryException extends Exception {
        private final DeliveryResult result;

        TransientDeliveryException(DeliveryResult result) {
            super(result.getError());
            this.result = result;
        }

        DeliveryResult getResult() {
            return result;
        }
    }
}
