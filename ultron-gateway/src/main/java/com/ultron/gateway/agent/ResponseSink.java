package com.ultron.gateway.agent;

/**
 * Receives response blocks as an agent run produces them.
 */
@FunctionalInterface
public interface ResponseSink {

    void accept(ResponseBlock block);
}
