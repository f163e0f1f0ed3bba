package com.ultron.gateway.queue;

import com.ultron.gateway.agent.CancellationToken;
import com.ultron.gateway.agent.RunCompletion;
import com.ultron.gateway.agent.SteeringInbox;
import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.session.SessionOrigin;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One queued agent run. Message lists and the summary request are mutated
 * only under the owning lane's monitor while the unit is pending.
 */
@Getter
public class WorkUnit {

    public enum Kind {
        /** Inbound message batch. */
        MESSAGE,
        /** Scheduled job prompt. */
        SCHEDULED,
        /** Webhook prompt. */
        HOOK
    }

    @Getter(AccessLevel.NONE)
    private static final AtomicLong SEQ = new AtomicLong();
    private static final int SUMMARY_LINE_MAX = 160;

    private final String id;
    private final Kind kind;
    private final String sessionKey;
    private final String agentId;
    private final String prompt;
    private final SessionOrigin origin;
    private final long enqueuedAt;
    private final CancellationToken token = new CancellationToken();
    private final SteeringInbox inbox = new SteeringInbox();
    private final CompletableFuture<RunCompletion> completion = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final List<InboundMessage> batch = new ArrayList<>();
    private volatile String laneKey;
    private volatile SummaryRequest summaryRequest;

    private WorkUnit(Kind kind, String sessionKey, String agentId, List<InboundMessage> messages,
            String prompt, SessionOrigin origin, long enqueuedAt) {
        this.id = "u" + SEQ.incrementAndGet();
        this.kind = kind;
        this.sessionKey = sessionKey;
        this.agentId = agentId;
        this.prompt = prompt;
        this.origin = origin != null ? origin : SessionOrigin.NONE;
        this.enqueuedAt = enqueuedAt;
        if (messages != null) {
            this.batch.addAll(messages);
        }
    }

    public static WorkUnit forMessages(String sessionKey, String agentId, List<InboundMessage> messages,
            SessionOrigin origin) {
        return new WorkUnit(Kind.MESSAGE, sessionKey, agentId, messages, null, origin, System.currentTimeMillis());
    }

    public static WorkUnit forPrompt(Kind kind, String sessionKey, String agentId, String prompt) {
        return new WorkUnit(kind, sessionKey, agentId, List.of(), prompt, SessionOrigin.NONE,
                System.currentTimeMillis());
    }

    /**
     * Unit that runs the same session with other messages, e.g. steering
     * leftovers.
     */
    public WorkUnit derive(List<InboundMessage> messages) {
        return new WorkUnit(Kind.MESSAGE, sessionKey, agentId, messages, null, origin, System.currentTimeMillis());
    }

    static WorkUnit synthetic(WorkUnit newest, List<InboundMessage> messages, SummaryRequest request) {
        WorkUnit unit = new WorkUnit(Kind.MESSAGE, newest.sessionKey, newest.agentId, messages,
                request.describe(), newest.origin, System.currentTimeMillis());
        unit.summaryRequest = request;
        return unit;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    /** Snapshot of the message batch. */
    public synchronized List<InboundMessage> getMessages() {
        return List.copyOf(batch);
    }

    synchronized void appendMessages(List<InboundMessage> messages) {
        batch.addAll(messages);
    }

    void assignLane(String laneKey) {
        this.laneKey = laneKey;
    }

    boolean canAbsorb(WorkUnit other) {
        return kind == Kind.MESSAGE && other.kind == Kind.MESSAGE
                && summaryRequest == null
                && sessionKey != null && sessionKey.equals(other.sessionKey);
    }

    /**
     * Make {@code other}'s completion follow this unit's.
     */
    void absorbCompletion(WorkUnit other) {
        completion.whenComplete((result, err) -> {
            if (err != null) {
                other.completion.complete(RunCompletion.failed(err));
            } else {
                other.completion.complete(result);
            }
        });
    }

    /**
     * How this unit is described when folded into a summary.
     */
    SummaryRequest asSummary() {
        if (summaryRequest != null) {
            return summaryRequest;
        }
        return new SummaryRequest(1, List.of(summaryLine()));
    }

    synchronized String summaryLine() {
        String text;
        if (!batch.isEmpty()) {
            InboundMessage last = batch.get(batch.size() - 1);
            text = last.senderLabel() + ": " + last.body().trim();
            if (batch.size() > 1) {
                text = text + " (+" + (batch.size() - 1) + " more)";
            }
        } else {
            text = prompt != null ? prompt.trim() : "";
        }
        return text.length() > SUMMARY_LINE_MAX ? text.substring(0, SUMMARY_LINE_MAX) + "…" : text;
    }

    @Override
    public String toString() {
        return "WorkUnit{" + id + ", " + kind + ", session=" + sessionKey + "}";
    }
}
