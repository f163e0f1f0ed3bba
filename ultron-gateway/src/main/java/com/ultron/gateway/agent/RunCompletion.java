package com.ultron.gateway.agent;

/**
 * Final outcome of a queued unit.
 */
public record RunCompletion(Status status, RunSummary summary, Throwable error) {

    public enum Status {
        COMPLETED, FAILED, CANCELLED, DROPPED
    }

    public static RunCompletion completed(RunSummary summary) {
        return new RunCompletion(Status.COMPLETED, summary, null);
    }

    public static RunCompletion failed(Throwable error) {
        return new RunCompletion(Status.FAILED, null, error);
    }

    public static RunCompletion cancelled() {
        return new RunCompletion(Status.CANCELLED, null, null);
    }

    public static RunCompletion dropped() {
        return new RunCompletion(Status.DROPPED, null, null);
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }
}
