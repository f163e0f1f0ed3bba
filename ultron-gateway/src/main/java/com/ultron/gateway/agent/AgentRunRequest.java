package com.ultron.gateway.agent;

import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.queue.SummaryRequest;
import com.ultron.gateway.session.TranscriptView;
import lombok.Builder;

import java.util.List;

/**
 * Everything an {@link AgentExecutor} needs for one run.
 *
 * @param history        pruned transcript before this batch
 * @param messages       new inbound batch, empty for scheduled units
 * @param prompt         prompt of a scheduled or hook unit, may be null
 * @param summaryRequest set when queue overflow collapsed several units
 */
@Builder
public record AgentRunRequest(
        String runId,
        String sessionKey,
        String agentId,
        String sessionId,
        boolean newSession,
        TranscriptView history,
        List<InboundMessage> messages,
        String prompt,
        CancellationToken cancellation,
        SteeringInbox steering,
        SummaryRequest summaryRequest) {

    public AgentRunRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
