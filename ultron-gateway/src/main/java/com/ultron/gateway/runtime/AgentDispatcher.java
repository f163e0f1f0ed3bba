package com.ultron.gateway.runtime;

import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.agent.AgentExecutor;
import com.ultron.gateway.agent.AgentRunRequest;
import com.ultron.gateway.agent.ResponseBlock;
import com.ultron.gateway.agent.ResponseSink;
import com.ultron.gateway.agent.RunCompletion;
import com.ultron.gateway.agent.RunSummary;
import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.outbound.DeliveryResult;
import com.ultron.gateway.outbound.OutboundDelivery;
import com.ultron.gateway.outbound.OutboundMessage;
import com.ultron.gateway.queue.EnqueueResult;
import com.ultron.gateway.queue.LaneWorker;
import com.ultron.gateway.queue.Lanes;
import com.ultron.gateway.queue.QueueManager;
import com.ultron.gateway.queue.QueueMode;
import com.ultron.gateway.queue.QueueSettings;
import com.ultron.gateway.queue.WorkUnit;
import com.ultron.gateway.session.SessionResolution;
import com.ultron.gateway.session.SessionStore;
import com.ultron.gateway.session.SessionStoreException;
import com.ultron.gateway.session.TranscriptTurn;
import com.ultron.gateway.session.TranscriptView;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.LongSupplier;

/**
 * Runs started units: prepares the session, calls the agent executor once,
 * records the outcome and sends the reply.
 *
 * <p>
 * Units started on a global lane are forwarded into their session lane, so
 * the global slot stays held until the session run completes.
 * </p>
 */
@Slf4j
public class AgentDispatcher implements LaneWorker {

    public static final String DEFAULT_ERROR_REPLY = "Sorry, I encountered an error while processing your message.";

    private final SessionStore sessions;
    private final AgentExecutor executor;
    private final OutboundDelivery delivery;
    private final QueueManager queue;
    private final RuntimeMetrics metrics;
    private final LongSupplier clock;
    private volatile UltronConfig config;

    public AgentDispatcher(SessionStore sessions,
            AgentExecutor executor,
            OutboundDelivery delivery,
            QueueManager queue,
            RuntimeMetrics metrics,
            UltronConfig config,
            LongSupplier clock) {
        this.sessions = sessions;
        this.executor = executor;
        this.delivery = delivery;
        this.queue = queue;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    public void applyConfig(UltronConfig config) {
        this.config = config;
    }

    @Override
    public CompletableFuture<RunCompletion> run(WorkUnit unit) {
        if (!Lanes.isSessionLane(unit.getLaneKey())) {
            return forwardToSession(unit);
        }
        return runInSession(unit);
    }

    // =========================================================================
    // Global lanes
    // =========================================================================

    private CompletableFuture<RunCompletion> forwardToSession(WorkUnit unit) {
        WorkUnit sessionUnit = WorkUnit.forPrompt(unit.getKind(), unit.getSessionKey(), unit.getAgentId(),
                unit.getPrompt());
        unit.getToken().onCancel(() -> sessionUnit.getToken().cancel(unit.getToken().getReason()));
        QueueSettings settings = QueueSettings.resolve(queueConfig(), null, null).withMode(QueueMode.FOLLOWUP);
        EnqueueResult result = queue.enqueue(Lanes.sessionLane(unit.getSessionKey()), sessionUnit, settings);
        log.debug("{} unit {} forwarded to session {} as {} ({})", unit.getLaneKey(), unit.getId(),
                unit.getSessionKey(), sessionUnit.getId(), result.outcome());
        return sessionUnit.getCompletion();
    }

    // =========================================================================
    // Session lanes
    // =========================================================================

    private CompletableFuture<RunCompletion> runInSession(WorkUnit unit) {
        String sessionKey = unit.getSessionKey();
        long startedAt = clock.getAsLong();
        metrics.onAgentRunStart();

        SessionResolution resolution;
        TranscriptView history;
        try {
            resolution = sessions.resolveForRun(sessionKey, unit.getOrigin(), startedAt);
            if (resolution.resetReason() != null) {
                metrics.increment(RuntimeMetrics.Counter.SESSIONS_RESET);
            }
            history = sessions.buildView(sessionKey);
            appendUserTurns(unit);
        } catch (SessionStoreException e) {
            metrics.onAgentRunEnd(clock.getAsLong() - startedAt);
            return CompletableFuture.completedFuture(fail(unit, e));
        }

        BufferingSink sink = new BufferingSink();
        AgentRunRequest request = AgentRunRequest.builder()
                .runId(UUID.randomUUID().toString())
                .sessionKey(sessionKey)
                .agentId(unit.getAgentId())
                .sessionId(resolution.record().getSessionId())
                .newSession(resolution.isNewSession())
                .history(history)
                .messages(unit.getMessages())
                .prompt(unit.getPrompt())
                .cancellation(unit.getToken())
                .steering(unit.getInbox())
                .summaryRequest(unit.getSummaryRequest())
                .build();

        log.debug("agent run {} starting: session={} agent={} messages={} new={}",
                request.runId(), sessionKey, unit.getAgentId(), request.messages().size(), request.newSession());

        CompletableFuture<RunSummary> run;
        try {
            run = executor.run(request, sink);
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        if (run == null) {
            run = CompletableFuture.failedFuture(new IllegalStateException("agent executor returned no future"));
        }
        return run.handle((summary, err) -> {
            try {
                return finish(unit, sink, summary, err);
            } finally {
                metrics.onAgentRunEnd(clock.getAsLong() - startedAt);
            }
        });
    }

    private void appendUserTurns(WorkUnit unit) {
        for (InboundMessage message : unit.getMessages()) {
            sessions.append(unit.getSessionKey(), TranscriptTurn.user(message));
        }
        if (unit.getKind() != WorkUnit.Kind.MESSAGE && unit.getPrompt() != null) {
            sessions.append(unit.getSessionKey(), TranscriptTurn.user(unit.getPrompt(), clock.getAsLong()));
        }
    }

    private RunCompletion finish(WorkUnit unit, BufferingSink sink, RunSummary summary, Throwable err) {
        Throwable cause = unwrap(err);
        if (unit.getToken().isCancelled() || cause instanceof CancellationException) {
            metrics.increment(RuntimeMetrics.Counter.RUNS_CANCELLED);
            log.info("agent run cancelled for session {} ({}); output discarded",
                    unit.getSessionKey(), unit.getToken().getReason());
            markOutcome(unit.getSessionKey(), "cancelled");
            return RunCompletion.cancelled();
        }
        if (cause != null) {
            return fail(unit, cause);
        }

        String sessionKey = unit.getSessionKey();
        RunSummary result = summary != null ? summary : RunSummary.of(null);
        try {
            long now = clock.getAsLong();
            for (InboundMessage steered : unit.getInbox().drainedMessages()) {
                sessions.append(sessionKey, TranscriptTurn.user(steered));
            }
            List<String> replyParts = new ArrayList<>();
            for (ResponseBlock block : sink.blocks()) {
                if (block.kind() == ResponseBlock.Kind.TOOL_RESULT) {
                    sessions.append(sessionKey, TranscriptTurn.toolResult(block.toolName(), block.text(), now));
                } else if (block.text() != null && !block.text().isBlank()) {
                    sessions.append(sessionKey, TranscriptTurn.assistant(block.text(), now));
                    replyParts.add(block.text());
                }
            }
            String reply = String.join("\n\n", replyParts);
            sessions.recordRun(sessionKey, result.usage(), lastUserText(unit), reply.isEmpty() ? null : reply);
            markOutcome(sessionKey, "completed");

            if (!reply.isEmpty()) {
                deliver(unit, reply);
            }
        } catch (SessionStoreException e) {
            return fail(unit, e);
        }

        metrics.increment(RuntimeMetrics.Counter.RUNS_COMPLETED);
        log.debug("agent run completed for session {}: {} tokens", sessionKey, result.usage().totalTokens());
        return RunCompletion.completed(result);
    }

    private RunCompletion fail(WorkUnit unit, Throwable err) {
        metrics.increment(RuntimeMetrics.Counter.RUNS_FAILED);
        log.error("agent run failed for session {}: {}", unit.getSessionKey(), String.valueOf(err.getMessage()), err);
        markOutcome(unit.getSessionKey(), "failed");
        UltronConfig.MessagesConfig messages = config != null ? config.getMessages() : null;
        boolean errorReplies = messages == null || !Boolean.FALSE.equals(messages.getErrorReplies());
        if (errorReplies) {
            String text = messages != null && messages.getErrorReplyText() != null
                    && !messages.getErrorReplyText().isBlank()
                            ? messages.getErrorReplyText()
                            : DEFAULT_ERROR_REPLY;
            deliver(unit, text);
        }
        return RunCompletion.failed(err);
    }

    /**
     * Best effort; the run outcome does not depend on it.
     */
    private void markOutcome(String sessionKey, String outcome) {
        try {
            sessions.updateRecord(sessionKey, record -> {
                if (record.getContext() == null) {
                    record.setContext(new LinkedHashMap<>());
                }
                record.getContext().put("lastOutcome", outcome);
            });
        } catch (SessionStoreException e) {
            log.warn("could not record outcome {} for session {}: {}", outcome, sessionKey, e.getMessage());
        }
    }

    /**
     * Reply to the conversation of the unit's newest message, steered ones
     * included. Scheduled and hook units have no conversation and deliver
     * nothing.
     */
    private void deliver(WorkUnit unit, String text) {
        List<InboundMessage> messages = new ArrayList<>(unit.getMessages());
        messages.addAll(unit.getInbox().drainedMessages());
        if (messages.isEmpty() || delivery == null) {
            log.debug("no reply target for unit {}", unit.getId());
            return;
        }
        InboundMessage source = messages.get(messages.size() - 1);
        DeliveryResult result = delivery.deliver(OutboundMessage.replyTo(source, text));
        metrics.increment(result.isSuccess()
                ? RuntimeMetrics.Counter.DELIVERIES_SENT
                : RuntimeMetrics.Counter.DELIVERIES_FAILED);
    }

    private static String lastUserText(WorkUnit unit) {
        List<InboundMessage> messages = unit.getMessages();
        if (!messages.isEmpty()) {
            return messages.get(messages.size() - 1).body();
        }
        return unit.getPrompt();
    }

    private UltronConfig.QueueConfig queueConfig() {
        return config != null ? config.getQueue() : null;
    }

    private static Throwable unwrap(Throwable err) {
        if (err instanceof CompletionException && err.getCause() != null) {
            return err.getCause();
        }
        return err;
    }

    /**
     * Holds response blocks until the run completes.
     */
    private static final class BufferingSink implements ResponseSink {
        private final List<ResponseBlock> blocks = new ArrayList<>();

        @Override
        public synchronized void accept(ResponseBlock block) {
            if (block != null) {
                blocks.add(block);
            }
        }

        synchronized List<ResponseBlock> blocks() {
            return List.copyOf(blocks);
        }
    }
}
