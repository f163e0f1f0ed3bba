package com.ultron.gateway.agent;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the agent runtime. Called exactly once per dequeued unit,
 * from inside the unit's session lane.
 *
 * <p>
 * Implementations stream reply text and tool results into {@code sink},
 * drain {@link AgentRunRequest#steering()} before each tool step, and check
 * {@link AgentRunRequest#cancellation()} at their safe points. The returned
 * future completes with usage once the run is over; completing it
 * exceptionally marks the run as failed.
 * </p>
 */
public interface AgentExecutor {

    CompletableFuture<RunSummary> run(AgentRunRequest request, ResponseSink sink);
}
