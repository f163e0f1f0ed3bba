package com.ultron.gateway.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ultron.common.config.AgentIds;
import com.ultron.common.config.ConfigPaths;
import com.ultron.common.config.ConfigService;
import com.ultron.common.config.UltronConfig;
import com.ultron.common.logging.SubsystemLogger;
import com.ultron.gateway.agent.AgentExecutor;
import com.ultron.gateway.agent.RunCompletion;
import com.ultron.gateway.inbound.InboundDedupe;
import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.inbound.InboundPipeline;
import com.ultron.gateway.outbound.ChannelAdapter;
import com.ultron.gateway.outbound.OutboundDelivery;
import com.ultron.gateway.queue.EnqueueResult;
import com.ultron.gateway.queue.Lanes;
import com.ultron.gateway.queue.QueueManager;
import com.ultron.gateway.queue.QueueMode;
import com.ultron.gateway.queue.QueueSettings;
import com.ultron.gateway.queue.WorkUnit;
import com.ultron.gateway.routing.NoAgentConfiguredException;
import com.ultron.gateway.routing.RouteResolver;
import com.ultron.gateway.routing.SessionKeys;
import com.ultron.gateway.session.SessionOrigin;
import com.ultron.gateway.session.SessionRecord;
import com.ultron.gateway.session.SessionStore;
import com.ultron.gateway.session.SessionStoreException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Owns the gateway's scheduling state: ingest queue, inbound pipeline,
 * routing table, lanes and sessions.
 *
 * <p>
 * Lifecycle: construct, {@link #start()}, {@link #shutdown()}. Channel
 * adapters feed {@link #submit}, which only offers to a bounded queue; one
 * ingest thread runs dedupe and debounce, and flushed batches are routed
 * and enqueued on their session lane.
 * </p>
 */
@Slf4j
public class GatewayRuntime {

    public static final int DEFAULT_INGEST_CAPACITY = 1024;
    public static final long DEFAULT_SHUTDOWN_DRAIN_MS = 30_000;
    private static final long DEDUPE_SWEEP_INTERVAL_MS = 60_000;
    private static final long INGEST_POLL_MS = 200;
    private static final SubsystemLogger inboundLog = SubsystemLogger.create("gateway/inbound");

    private final RuntimeMetrics metrics = new RuntimeMetrics();
    private final RouteResolver routes;
    private final SessionStore sessions;
    private final QueueManager queue;
    private final AgentDispatcher dispatcher;
    private final InboundPipeline inbound;
    private final OutboundDelivery delivery;
    private final SessionResetScheduler resetScheduler;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final BlockingQueue<InboundMessage> ingest;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile UltronConfig config;
    private volatile Thread ingestThread;
    private volatile ScheduledFuture<?> dedupeSweepTask;

    public GatewayRuntime(UltronConfig config, Path stateDir, AgentExecutor executor, OutboundDelivery delivery) {
        this(config, stateDir, executor, delivery, ZoneId.systemDefault(), System::currentTimeMillis);
    }

    public GatewayRuntime(UltronConfig config,
            Path stateDir,
            AgentExecutor executor,
            OutboundDelivery delivery,
            ZoneId zone,
            LongSupplier clock) {
        this.config = ConfigService.applyDefaults(config != null ? config : new UltronConfig());
        this.delivery = delivery != null ? delivery : new OutboundDelivery();

        UltronConfig.InboundConfig inboundCfg = this.config.getMessages().getInbound();
        int capacity = inboundCfg.getIngestCapacity() != null && inboundCfg.getIngestCapacity() > 0
                ? inboundCfg.getIngestCapacity()
                : DEFAULT_INGEST_CAPACITY;
        this.ingest = new ArrayBlockingQueue<>(capacity);

        this.workers = Executors.newFixedThreadPool(resolveWorkerThreads(this.config), namedThreads("agent-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("gateway-scheduler"));

        this.routes = new RouteResolver(this.config);
        this.sessions = new SessionStore(stateDir != null ? stateDir : ConfigPaths.resolveStateDir(this.config),
                this.config.getSession(), new ObjectMapper(), null, zone, clock);
        this.queue = new QueueManager(workers, metrics);
        this.dispatcher = new AgentDispatcher(sessions, executor, this.delivery, queue, metrics, this.config, clock);
        this.queue.bindWorker(dispatcher);
        this.queue.applyLaneCapacities(this.config.getQueue().getLanes());

        InboundDedupe dedupe = new InboundDedupe(
                inboundCfg.getDedupeTtlMs() != null ? inboundCfg.getDedupeTtlMs() : InboundDedupe.DEFAULT_TTL_MS,
                inboundCfg.getDedupeMaxEntries() != null
                        ? inboundCfg.getDedupeMaxEntries()
                        : InboundDedupe.DEFAULT_MAX_ENTRIES,
                clock);
        this.inbound = new InboundPipeline(dedupe, inboundCfg, metrics, this::dispatchBatch);
        this.resetScheduler = new SessionResetScheduler(sessions, queue, metrics, scheduler, zone, clock);
        this.resetScheduler.applyConfig(this.config.getSession());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load persisted sessions, start the ingest loop, maintenance tasks and
     * channel adapters.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int loaded = sessions.loadAll();

        Thread thread = new Thread(this::ingestLoop, "gateway-ingest");
        thread.setDaemon(true);
        ingestThread = thread;
        thread.start();

        dedupeSweepTask = scheduler.scheduleAtFixedRate(inbound::sweepDedupe,
                DEDUPE_SWEEP_INTERVAL_MS, DEDUPE_SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
        resetScheduler.start();

        for (ChannelAdapter adapter : delivery.getAdapters()) {
            try {
                adapter.start(this::submit);
            } catch (RuntimeException e) {
                log.error("failed to start channel adapter {}: {}", adapter.provider(), e.getMessage(), e);
            }
        }
        log.info("gateway runtime started: {} session(s) loaded, ingest capacity {}",
                loaded, ingest.remainingCapacity() + ingest.size());
    }

    /**
     * Stop adapters and intake, flush debounced input, then drain lanes for
     * up to {@code gateway.shutdownDrainMs} before cancelling the rest.
     *
     * @return true if every lane drained
     */
    public boolean shutdown() {
        if (!running.compareAndSet(true, false)) {
            return true;
        }
        log.info("gateway runtime stopping");
        for (ChannelAdapter adapter : delivery.getAdapters()) {
            try {
                adapter.stop();
            } catch (RuntimeException e) {
                log.warn("error stopping channel adapter {}: {}", adapter.provider(), e.getMessage());
            }
        }

        Thread thread = ingestThread;
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        inbound.flushAll();
        inbound.shutdown();

        if (dedupeSweepTask != null) {
            dedupeSweepTask.cancel(false);
        }
        resetScheduler.stop();

        Long drainMs = config.getGateway().getShutdownDrainMs();
        boolean drained = queue.shutdown(true, drainMs != null ? drainMs : DEFAULT_SHUTDOWN_DRAIN_MS);

        scheduler.shutdownNow();
        workers.shutdown();
        log.info("gateway runtime stopped (drained={})", drained);
        return drained;
    }

    public boolean isRunning() {
        return running.get();
    }

    // =========================================================================
    // Ingestion
    // =========================================================================

    /**
     * Hand an inbound message to the runtime. Never blocks.
     *
     * @return false if the runtime is stopped or the ingest queue is full
     */
    public boolean submit(InboundMessage message) {
        if (!running.get()) {
            log.debug("runtime not running, message from {} ignored", message.provider());
            return false;
        }
        if (!ingest.offer(message)) {
            metrics.increment(RuntimeMetrics.Counter.INGEST_REJECTED);
            inboundLog.warn("ingest queue full, message rejected", Map.of(
                    "provider", String.valueOf(message.provider()),
                    "messageId", String.valueOf(message.messageId())));
            return false;
        }
        return true;
    }

    private void ingestLoop() {
        while (running.get() || !ingest.isEmpty()) {
            InboundMessage message;
            try {
                message = ingest.poll(INGEST_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message == null) {
                continue;
            }
            try {
                inbound.accept(message);
            } catch (RuntimeException e) {
                inboundLog.error("inbound processing failed", Map.of(
                        "provider", String.valueOf(message.provider()),
                        "messageId", String.valueOf(message.messageId())), e);
            }
        }
    }

    /**
     * Route a debounced batch and put it on its session lane.
     */
    void dispatchBatch(List<InboundMessage> batch) {
        if (batch.isEmpty()) {
            return;
        }
        InboundMessage first = batch.get(0);
        RouteResolver.ResolvedRoute route;
        try {
            route = routes.resolve(first);
        } catch (NoAgentConfiguredException e) {
            metrics.increment(RuntimeMetrics.Counter.ROUTING_FAILED);
            inboundLog.error("no agent for batch, dropped", Map.of(
                    "provider", String.valueOf(first.provider()),
                    "messages", batch.size(),
                    "reason", String.valueOf(e.getMessage())));
            return;
        }

        String sessionQueueMode = null;
        try {
            sessionQueueMode = sessions.find(route.sessionKey()).map(SessionRecord::getQueueMode).orElse(null);
        } catch (SessionStoreException e) {
            log.warn("session index unavailable for {}: {}", route.sessionKey(), e.getMessage());
        }
        QueueSettings settings = QueueSettings.resolve(config.getQueue(), first.provider(), sessionQueueMode);

        InboundMessage newest = batch.get(batch.size() - 1);
        WorkUnit unit = WorkUnit.forMessages(route.sessionKey(), route.agentId(), batch, SessionOrigin.from(newest));
        EnqueueResult result = queue.enqueue(Lanes.sessionLane(route.sessionKey()), unit, settings);
        log.debug("batch of {} routed to {} via {} ({})", batch.size(), route.sessionKey(), route.matchedBy(),
                result.outcome());
    }

    // =========================================================================
    // Scheduled / webhook entry points
    // =========================================================================

    /**
     * Queue a scheduled job run on the {@code cron} lane; it executes in
     * session {@code cron:<jobId>}.
     */
    public CompletableFuture<RunCompletion> enqueueScheduled(String jobId, String agentId, String prompt) {
        return enqueueGlobal(Lanes.CRON, WorkUnit.Kind.SCHEDULED, SessionKeys.cronKey(jobId), agentId, prompt);
    }

    /**
     * Queue a webhook run on the {@code hook} lane; it executes in session
     * {@code hook:<hookId>}.
     */
    public CompletableFuture<RunCompletion> enqueueHook(String hookId, String agentId, String prompt) {
        return enqueueGlobal(Lanes.HOOK, WorkUnit.Kind.HOOK, SessionKeys.hookKey(hookId), agentId, prompt);
    }

    private CompletableFuture<RunCompletion> enqueueGlobal(String lane, WorkUnit.Kind kind, String sessionKey,
            String agentId, String prompt) {
        String resolvedAgent = agentId != null && !agentId.isBlank()
                ? AgentIds.normalizeAgentId(agentId)
                : Optional.ofNullable(routes.getDefaultAgentId()).orElse(AgentIds.DEFAULT_AGENT_ID);
        WorkUnit unit = WorkUnit.forPrompt(kind, sessionKey, resolvedAgent, prompt);
        queue.enqueue(lane, unit, QueueSettings.DEFAULT.withMode(QueueMode.FOLLOWUP));
        return unit.getCompletion();
    }

    // =========================================================================
    // Sessions / config
    // =========================================================================

    /**
     * Cancel the session's lane, then archive the session.
     *
     * @return the archived record, empty if the session did not exist
     */
    public Optional<SessionRecord> resetSession(String sessionKey, String reason) {
        queue.cancel(Lanes.sessionLane(sessionKey), "session reset");
        Optional<SessionRecord> archived = sessions.reset(sessionKey, reason != null ? reason : "manual");
        if (archived.isPresent()) {
            metrics.increment(RuntimeMetrics.Counter.SESSIONS_RESET);
        }
        return archived;
    }

    /**
     * Swap routing, debounce, queue and reset settings. Lane contents and
     * running units are left alone.
     */
    public void applyConfig(UltronConfig newConfig) {
        UltronConfig cfg = ConfigService.applyDefaults(newConfig);
        this.config = cfg;
        routes.loadFromConfig(cfg);
        inbound.applyConfig(cfg.getMessages().getInbound());
        sessions.applyConfig(cfg.getSession());
        queue.applyLaneCapacities(cfg.getQueue().getLanes());
        dispatcher.applyConfig(cfg);
        resetScheduler.applyConfig(cfg.getSession());
        log.info("runtime config applied");
    }

    public UltronConfig getConfig() {
        return config;
    }

    public RuntimeMetrics getMetrics() {
        return metrics;
    }

    public SessionStore getSessions() {
        return sessions;
    }

    public QueueManager getQueue() {
        return queue;
    }

    public RouteResolver getRoutes() {
        return routes;
    }

    public OutboundDelivery getDelivery() {
        return delivery;
    }

    public SessionResetScheduler getResetScheduler() {
        return resetScheduler;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static int resolveWorkerThreads(UltronConfig config) {
        Integer configured = config.getGateway() != null ? config.getGateway().getWorkerThreads() : null;
        if (configured != null && configured > 0) {
            return configured;
        }
        return Math.max(4, Runtime.getRuntime().availableProcessors());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
