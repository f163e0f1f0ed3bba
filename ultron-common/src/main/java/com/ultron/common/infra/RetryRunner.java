package com.ultron.common.infra;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

/**
 * Generic retry executor with exponential backoff, jitter and configurable
 * shouldRetry / onRetry hooks.
 */
public final class RetryRunner {

    // ── Configuration ──────────────────────────────────────────────────

    /**
     * Retry configuration.
     *
     * @param attempts   maximum number of attempts (>= 1)
     * @param minDelayMs delay before the first retry in ms
     * @param maxDelayMs maximum delay between retries in ms
     * @param jitter     jitter ratio (0..1); 0 = no jitter
     */
    public record Config(int attempts, long minDelayMs, long maxDelayMs, double jitter) {

        public static final Config DEFAULT = new Config(3, 300, 30_000, 0.0);

        /** Session index and transcript file IO. */
        public static final Config FILE_IO = new Config(3, 50, 1_000, 0.0);

        /** Outbound sends through channel adapters. */
        public static final Config DELIVERY = new Config(3, 500, 30_000, 0.1);
    }

    /**
     * Information passed to onRetry callback.
     */
    public record RetryInfo(int attempt, int maxAttempts, long delayMs, Throwable err, String label) {
    }

    /** Pause between attempts; swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long ms) throws InterruptedException;
    }

    // ── Fields ──────────────────────────────────────────────────────────

    private final Config config;
    private final BiPredicate<Throwable, Integer> shouldRetry;
    private final Consumer<RetryInfo> onRetry;
    private final Sleeper sleeper;

    // ── Constructors ────────────────────────────────────────────────────

    public RetryRunner(Config config,
            BiPredicate<Throwable, Integer> shouldRetry,
            Consumer<RetryInfo> onRetry,
            Sleeper sleeper) {
        this.config = config != null ? config : Config.DEFAULT;
        this.shouldRetry = shouldRetry != null ? shouldRetry : (err, attempt) -> true;
        this.onRetry = onRetry;
        this.sleeper = sleeper != null ? sleeper : Thread::sleep;
    }

    public RetryRunner(Config config, BiPredicate<Throwable, Integer> shouldRetry, Consumer<RetryInfo> onRetry) {
        this(config, shouldRetry, onRetry, null);
    }

    public RetryRunner(Config config) {
        this(config, null, null, null);
    }

    public RetryRunner() {
        this(Config.DEFAULT);
    }

    // ── Execute ─────────────────────────────────────────────────────────

    /**
     * Execute the callable with retry logic.
     *
     * @param fn    the operation to retry
     * @param label optional label for logging
     * @param <T>   return type
     * @return the result of the first successful call
     * @throws Exception the last exception if all attempts fail
     */
    public <T> T execute(Callable<T> fn, String label) throws Exception {
        int maxAttempts = Math.max(1, config.attempts());
        long minDelay = Math.max(0, config.minDelayMs());
        long maxDelay = config.maxDelayMs() > 0 ? config.maxDelayMs() : Long.MAX_VALUE;
        Exception lastErr = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return fn.call();
            } catch (InterruptedException err) {
                Thread.currentThread().interrupt();
                throw err;
            } catch (Exception err) {
                lastErr = err;
                if (attempt >= maxAttempts || !shouldRetry.test(err, attempt)) {
                    break;
                }

                long delay = computeDelay(attempt, minDelay, maxDelay, config.jitter());
                if (onRetry != null) {
                    onRetry.accept(new RetryInfo(attempt, maxAttempts, delay, err, label));
                }
                sleeper.sleep(delay);
            }
        }
        throw lastErr;
    }

    /**
     * Execute with no label.
     */
    public <T> T execute(Callable<T> fn) throws Exception {
        return execute(fn, null);
    }

    /**
     * Delay before retry number {@code attempt}: {@code minDelay * 2^(attempt-1)},
     * jittered, clamped to {@code [minDelay, maxDelay]}.
     */
    static long computeDelay(int attempt, long minDelay, long maxDelay, double jitter) {
        long baseDelay = minDelay * (1L << Math.min(attempt - 1, 30));
        long delay = Math.min(baseDelay, maxDelay);
        delay = applyJitter(delay, jitter);
        return Math.min(Math.max(delay, minDelay), maxDelay);
    }

    // ── Private ─────────────────────────────────────────────────────────

    private static long applyJitter(long delayMs, double jitter) {
        if (jitter <= 0) {
            return delayMs;
        }
        double offset = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * Math.min(jitter, 1.0);
        return Math.max(0, Math.round(delayMs * (1 + offset)));
    }
}
