package com.ultron.gateway.runtime;

import com.ultron.common.config.SessionReset;
import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.queue.Lanes;
import com.ultron.gateway.queue.QueueManager;
import com.ultron.gateway.session.SessionStore;
import com.ultron.gateway.session.SessionStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Archives stale sessions at the daily reset hour. Only sessions whose lane
 * is idle are touched; busy ones are reset lazily on their next run.
 */
@Slf4j
public class SessionResetScheduler {

    private final SessionStore sessions;
    private final QueueManager queue;
    private final RuntimeMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final ZoneId zone;
    private final LongSupplier clock;
    private final AtomicReference<ScheduledFuture<?>> scheduled = new AtomicReference<>();
    private volatile int atHour;
    private volatile boolean running;

    public SessionResetScheduler(SessionStore sessions,
            QueueManager queue,
            RuntimeMetrics metrics,
            ScheduledExecutorService scheduler,
            ZoneId zone,
            LongSupplier clock) {
        this.sessions = sessions;
        this.queue = queue;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.zone = zone != null ? zone : ZoneId.systemDefault();
        this.clock = clock != null ? clock : System::currentTimeMillis;
        this.atHour = SessionReset.DEFAULT_RESET_AT_HOUR;
    }

    public void start() {
        running = true;
        scheduleNext();
    }

    public void stop() {
        running = false;
        ScheduledFuture<?> future = scheduled.getAndSet(null);
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * Pick up a changed {@code session.reset.atHour}.
     */
    public void applyConfig(UltronConfig.SessionConfig session) {
        int hour = resolveAtHour(session);
        if (hour != atHour) {
            atHour = hour;
            if (running) {
                scheduleNext();
            }
        }
    }

    /**
     * Reset every stale session with an idle lane.
     *
     * @return reset session keys
     */
    public List<String> sweep() {
        List<String> reset = sessions.sweepStale(clock.getAsLong(),
                key -> queue.isIdle(Lanes.sessionLane(key)));
        for (int i = 0; i < reset.size(); i++) {
            metrics.increment(RuntimeMetrics.Counter.SESSIONS_RESET);
        }
        return reset;
    }

    public int getAtHour() {
        return atHour;
    }

    private void scheduleNext() {
        long now = clock.getAsLong();
        long next = SessionReset.resolveNextDailyResetAtMs(now, atHour, zone);
        ScheduledFuture<?> future = scheduler.schedule(this::fire, next - now, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = scheduled.getAndSet(future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("next session reset sweep in {}ms (atHour={})", next - now, atHour);
    }

    private void fire() {
        try {
            List<String> reset = sweep();
            log.info("daily session reset sweep: {} session(s) archived", reset.size());
        } catch (SessionStoreException e) {
            log.error("daily session reset sweep failed: {}", e.getMessage(), e);
        } finally {
            if (running) {
                scheduleNext();
            }
        }
    }

    static int resolveAtHour(UltronConfig.SessionConfig session) {
        if (session == null || session.getReset() == null || session.getReset().getAtHour() == null) {
            return SessionReset.DEFAULT_RESET_AT_HOUR;
        }
        return SessionReset.normalizeResetAtHour(session.getReset().getAtHour());
    }
}
