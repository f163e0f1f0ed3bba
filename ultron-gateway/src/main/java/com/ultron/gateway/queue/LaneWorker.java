package com.ultron.gateway.queue;

import com.ultron.gateway.agent.RunCompletion;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a unit once the lane has room for it. The lane stays occupied until
 * the returned future completes.
 */
@FunctionalInterface
public interface LaneWorker {

    CompletableFuture<RunCompletion> run(WorkUnit unit);
}
