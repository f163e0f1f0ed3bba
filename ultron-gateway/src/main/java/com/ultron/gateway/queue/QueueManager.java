package com.ultron.gateway.queue;

import com.ultron.gateway.agent.RunCompletion;
import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.runtime.RuntimeMetrics;
import com.ultron.gateway.runtime.RuntimeMetrics.Counter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lane-aware scheduler for agent runs.
 *
 * <p>
 * Session lanes ({@code session:<key>}) run one unit at a time; global lanes
 * run up to their configured capacity and always queue in followup mode.
 * All state changes of a lane happen under that lane's monitor, lanes are
 * independent of each other, and {@link #enqueue} never blocks on a run.
 * Units are started on the worker executor; a lane slot is held until the
 * {@link LaneWorker}'s future completes.
 * </p>
 */
@Slf4j
public class QueueManager {

    private final Map<String, QueueLane> lanes = new ConcurrentHashMap<>();
    private final Executor executor;
    private final RuntimeMetrics metrics;
    private volatile LaneWorker worker;
    private volatile Map<String, Integer> laneCapacities = Map.of();
    private volatile boolean accepting = true;

    public QueueManager(Executor executor, RuntimeMetrics metrics) {
        this.executor = executor;
        this.metrics = metrics != null ? metrics : new RuntimeMetrics();
    }

    /**
     * Set the worker that runs started units. Must be called before the
     * first enqueue.
     */
    public void bindWorker(LaneWorker worker) {
        this.worker = worker;
    }

    // =========================================================================
    // Enqueue
    // =========================================================================

    /**
     * Admit a unit to a lane according to the mode and overflow policy.
     */
    public EnqueueResult enqueue(String laneKey, WorkUnit unit, QueueSettings settings) {
        QueueSettings effective = settings != null ? settings : QueueSettings.DEFAULT;
        if (!accepting) {
            log.debug("queue closed, rejecting unit {} for lane {}", unit.getId(), laneKey);
            unit.getCompletion().complete(RunCompletion.dropped());
            return new EnqueueResult(EnqueueResult.Outcome.REJECTED, unit, List.of(unit));
        }
        if (worker == null) {
            throw new IllegalStateException("no lane worker bound");
        }
        QueueMode mode = Lanes.isSessionLane(laneKey) ? effective.mode() : QueueMode.FOLLOWUP;

        while (true) {
            QueueLane lane = lanes.computeIfAbsent(laneKey,
                    k -> new QueueLane(k, Lanes.capacityFor(k, laneCapacities)));
            Admission admission;
            List<WorkUnit> started;
            synchronized (lane) {
                if (lane.retired) {
                    continue;
                }
                unit.assignLane(laneKey);
                admission = admitLocked(lane, unit, mode, effective);
                started = lane.takeStartable();
            }
            return afterAdmission(laneKey, unit, admission, started);
        }
    }

    public EnqueueResult enqueue(String laneKey, WorkUnit unit, QueueMode mode) {
        return enqueue(laneKey, unit, QueueSettings.DEFAULT.withMode(mode));
    }

    private record Admission(
            EnqueueResult.Outcome outcome,
            WorkUnit target,
            List<WorkUnit> dropped,
            List<WorkUnit> absorbed,
            WorkUnit interrupted,
            OverflowPolicy overflow) {

        static Admission of(EnqueueResult.Outcome outcome, WorkUnit target) {
            return new Admission(outcome, target, List.of(), List.of(), null, null);
        }
    }

    private Admission admitLocked(QueueLane lane, WorkUnit unit, QueueMode mode, QueueSettings settings) {
        if (!lane.hasWork()) {
            lane.pending.addLast(unit);
            return Admission.of(EnqueueResult.Outcome.QUEUED, unit);
        }
        switch (mode) {
            case COLLECT -> {
                WorkUnit target = lane.pending.peekLast();
                if (target != null && target.canAbsorb(unit)) {
                    target.appendMessages(unit.getMessages());
                    return new Admission(EnqueueResult.Outcome.MERGED, target, List.of(), List.of(unit), null, null);
                }
            }
            case STEER -> {
                WorkUnit running = lane.firstRunning();
                if (running != null
                        && running.getKind() == WorkUnit.Kind.MESSAGE
                        && !running.getToken().isCancelled()
                        && running.getInbox().offer(unit.getMessages())) {
                    return new Admission(EnqueueResult.Outcome.STEERED, running, List.of(), List.of(unit), null,
                            null);
                }
            }
            case INTERRUPT -> {
                return addWithOverflow(lane, unit, settings, lane.firstRunning());
            }
            default -> {
            }
        }
        return addWithOverflow(lane, unit, settings, null);
    }

    /**
     * Add a unit at the tail, or at the head when interrupting, applying the
     * overflow policy on session lanes.
     */
    private Admission addWithOverflow(QueueLane lane, WorkUnit unit, QueueSettings settings, WorkUnit interrupted) {
        boolean head = interrupted != null;
        EnqueueResult.Outcome outcome = head ? EnqueueResult.Outcome.INTERRUPTED : EnqueueResult.Outcome.QUEUED;

        if (lane.session && lane.pending.size() >= settings.cap()) {
            switch (settings.overflow()) {
                case DROP_OLD -> {
                    WorkUnit oldest = lane.pending.pollFirst();
                    addToLane(lane, unit, head);
                    return new Admission(outcome, unit, List.of(oldest), List.of(), interrupted,
                            OverflowPolicy.DROP_OLD);
                }
                case DROP_NEW -> {
                    return new Admission(EnqueueResult.Outcome.REJECTED, unit, List.of(unit), List.of(),
                            null, OverflowPolicy.DROP_NEW);
                }
                case SUMMARIZE -> {
                    List<WorkUnit> folded = new ArrayList<>(lane.pending);
                    folded.add(unit);
                    lane.pending.clear();
                    List<InboundMessage> messages = new ArrayList<>();
                    SummaryRequest request = new SummaryRequest(0, List.of());
                    for (WorkUnit f : folded) {
                        messages.addAll(f.getMessages());
                        request = request.merge(f.asSummary());
                    }
                    WorkUnit synthetic = WorkUnit.synthetic(unit, messages, request);
                    synthetic.assignLane(lane.key);
                    lane.pending.addLast(synthetic);
                    return new Admission(EnqueueResult.Outcome.SUMMARIZED, synthetic, List.of(), folded,
                            interrupted, OverflowPolicy.SUMMARIZE);
                }
            }
        }
        addToLane(lane, unit, head);
        return new Admission(outcome, unit, List.of(), List.of(), interrupted, null);
    }

    private static void addToLane(QueueLane lane, WorkUnit unit, boolean head) {
        if (head) {
            lane.pending.addFirst(unit);
        } else {
            lane.pending.addLast(unit);
        }
    }

    private EnqueueResult afterAdmission(String laneKey, WorkUnit unit, Admission admission, List<WorkUnit> started) {
        for (WorkUnit absorbed : admission.absorbed()) {
            admission.target().absorbCompletion(absorbed);
        }
        for (WorkUnit dropped : admission.dropped()) {
            dropped.getCompletion().complete(RunCompletion.dropped());
        }
        if (admission.interrupted() != null
                && admission.interrupted().getToken().cancel("interrupted by unit " + unit.getId())) {
            metrics.increment(Counter.UNITS_INTERRUPTED);
            log.info("lane {}: interrupted running unit {}", laneKey, admission.interrupted().getId());
        }

        switch (admission.outcome()) {
            case MERGED -> metrics.increment(Counter.UNITS_MERGED);
            case STEERED -> metrics.increment(Counter.UNITS_STEERED);
            case QUEUED, INTERRUPTED -> metrics.increment(Counter.UNITS_ENQUEUED);
            default -> {
            }
        }
        if (admission.overflow() != null) {
            logOverflow(laneKey, admission);
        }

        EnqueueResult.Outcome outcome = admission.outcome();
        if (outcome == EnqueueResult.Outcome.QUEUED && started.contains(unit)) {
            outcome = EnqueueResult.Outcome.STARTED;
        }
        for (WorkUnit next : started) {
            start(next);
        }
        return new EnqueueResult(outcome, admission.target(), admission.dropped());
    }

    private void logOverflow(String laneKey, Admission admission) {
        switch (admission.overflow()) {
            case DROP_OLD -> {
                metrics.increment(Counter.OVERFLOW_DROPPED_OLD);
                log.info("lane {} overflow: dropped oldest pending unit {}", laneKey,
                        admission.dropped().get(0).getId());
            }
            case DROP_NEW -> {
                metrics.increment(Counter.OVERFLOW_DROPPED_NEW);
                log.info("lane {} overflow: dropped incoming unit {}", laneKey, admission.target().getId());
            }
            case SUMMARIZE -> {
                metrics.increment(Counter.OVERFLOW_SUMMARIZED);
                log.info("lane {} overflow: collapsed {} units into {}", laneKey,
                        admission.absorbed().size(), admission.target().getId());
            }
        }
    }

    // =========================================================================
    // Run / release
    // =========================================================================

    private void start(WorkUnit unit) {
        try {
            executor.execute(() -> runUnit(unit));
        } catch (RejectedExecutionException e) {
            log.warn("worker executor rejected unit {}: {}", unit.getId(), e.getMessage());
            finish(unit, RunCompletion.failed(e));
        }
    }

    private void runUnit(WorkUnit unit) {
        if (unit.getToken().isCancelled()) {
            finish(unit, RunCompletion.cancelled());
            return;
        }
        CompletableFuture<RunCompletion> future;
        try {
            future = worker.run(unit);
        } catch (RuntimeException e) {
            log.error("lane worker failed for unit {}", unit.getId(), e);
            future = CompletableFuture.completedFuture(RunCompletion.failed(e));
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(
                    RunCompletion.failed(new IllegalStateException("lane worker returned no result")));
        }
        future.whenComplete((result, err) -> {
            if (err != null) {
                finish(unit, RunCompletion.failed(unwrap(err)));
            } else {
                finish(unit, result != null ? result
                        : RunCompletion.failed(new IllegalStateException("lane worker returned no result")));
            }
        });
    }

    private void finish(WorkUnit unit, RunCompletion result) {
        try {
            release(unit);
        } finally {
            unit.getCompletion().complete(result);
        }
    }

    /**
     * Free the unit's slot and start whatever is next. Steering messages the
     * unit never drained go back to the head of the lane. An empty lane is
     * retired from the table. Calling it twice for one unit is a no-op.
     */
    public void release(WorkUnit unit) {
        String laneKey = unit.getLaneKey();
        QueueLane lane = laneKey != null ? lanes.get(laneKey) : null;
        if (lane == null) {
            return;
        }
        List<WorkUnit> started;
        synchronized (lane) {
            if (!lane.running.remove(unit)) {
                return;
            }
            List<InboundMessage> leftovers = unit.getInbox().close();
            if (!leftovers.isEmpty()) {
                WorkUnit requeued = unit.derive(leftovers);
                requeued.assignLane(laneKey);
                lane.pending.addFirst(requeued);
                log.debug("lane {}: re-queued {} undrained steering messages as {}",
                        laneKey, leftovers.size(), requeued.getId());
            }
            started = lane.takeStartable();
            if (!lane.hasWork()) {
                lane.retired = true;
                lanes.remove(laneKey, lane);
            }
        }
        for (WorkUnit next : started) {
            start(next);
        }
    }

    /**
     * Cancel the running units of a lane and drop everything pending. Running
     * units release their slot when their run returns.
     *
     * @return number of units cancelled or dropped
     */
    public int cancel(String laneKey, String reason) {
        QueueLane lane = lanes.get(laneKey);
        if (lane == null) {
            return 0;
        }
        List<WorkUnit> running;
        List<WorkUnit> dropped;
        synchronized (lane) {
            running = new ArrayList<>(lane.running);
            dropped = new ArrayList<>(lane.pending);
            lane.pending.clear();
            for (WorkUnit unit : running) {
                unit.getInbox().close();
            }
        }
        for (WorkUnit unit : running) {
            unit.getToken().cancel(reason);
        }
        for (WorkUnit unit : dropped) {
            unit.getCompletion().complete(RunCompletion.dropped());
        }
        if (!running.isEmpty() || !dropped.isEmpty()) {
            log.info("lane {} cancelled ({}): {} running, {} pending dropped",
                    laneKey, reason, running.size(), dropped.size());
        }
        return running.size() + dropped.size();
    }

    public int cancel(String laneKey) {
        return cancel(laneKey, "cancelled");
    }

    // =========================================================================
    // Config / lifecycle
    // =========================================================================

    /**
     * Swap global lane capacities. Lanes that grew start waiting units right
     * away; lanes that shrank finish their running units first.
     */
    public void applyLaneCapacities(Map<String, Integer> capacities) {
        this.laneCapacities = capacities != null ? Map.copyOf(capacities) : Map.of();
        for (QueueLane lane : lanes.values()) {
            if (lane.session) {
                continue;
            }
            List<WorkUnit> started;
            synchronized (lane) {
                lane.capacity = Lanes.capacityFor(lane.key, laneCapacities);
                started = lane.takeStartable();
            }
            for (WorkUnit next : started) {
                start(next);
            }
        }
    }

    public int laneCapacity(String laneKey) {
        return Lanes.capacityFor(laneKey, laneCapacities);
    }

    /**
     * Stop intake. With {@code drain}, wait up to {@code timeoutMs} for all
     * lanes to empty; whatever is still there afterwards is cancelled.
     *
     * @return true if every lane drained
     */
    public boolean shutdown(boolean drain, long timeoutMs) {
        accepting = false;
        if (drain) {
            long deadline = System.currentTimeMillis() + timeoutMs;
            while (!isIdle()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    break;
                }
                try {
                    CompletableFuture.allOf(outstanding().toArray(new CompletableFuture[0]))
                            .get(remaining, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ExecutionException e) {
                    log.debug("unit completed exceptionally during drain: {}", e.getMessage());
                }
            }
        }
        boolean drained = isIdle();
        if (!drained) {
            for (String laneKey : new ArrayList<>(lanes.keySet())) {
                cancel(laneKey, "shutdown");
            }
            log.warn("queue shutdown with work outstanding; lanes cancelled");
        }
        return drained;
    }

    private List<CompletableFuture<RunCompletion>> outstanding() {
        List<CompletableFuture<RunCompletion>> futures = new ArrayList<>();
        for (QueueLane lane : lanes.values()) {
            synchronized (lane) {
                lane.running.forEach(u -> futures.add(u.getCompletion()));
                lane.pending.forEach(u -> futures.add(u.getCompletion()));
            }
        }
        return futures;
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    public boolean isIdle(String laneKey) {
        QueueLane lane = lanes.get(laneKey);
        if (lane == null) {
            return true;
        }
        synchronized (lane) {
            return !lane.hasWork();
        }
    }

    public boolean isIdle() {
        for (QueueLane lane : lanes.values()) {
            synchronized (lane) {
                if (lane.hasWork()) {
                    return false;
                }
            }
        }
        return true;
    }

    public Optional<LaneSnapshot> snapshot(String laneKey) {
        QueueLane lane = lanes.get(laneKey);
        if (lane == null) {
            return Optional.empty();
        }
        synchronized (lane) {
            return Optional.of(lane.snapshot());
        }
    }

    public Map<String, LaneSnapshot> snapshots() {
        Map<String, LaneSnapshot> result = new HashMap<>();
        for (QueueLane lane : lanes.values()) {
            synchronized (lane) {
                result.put(lane.key, lane.snapshot());
            }
        }
        return result;
    }

    public boolean isAccepting() {
        return accepting;
    }

    private static Throwable unwrap(Throwable err) {
        if (err instanceof CompletionException && err.getCause() != null) {
            return err.getCause();
        }
        return err;
    }
}
