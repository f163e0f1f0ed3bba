package com.ultron.gateway.routing;

/**
 * Thrown when a message cannot be routed because no agent is configured.
 */
public class NoAgentConfiguredException extends RuntimeException {

    public NoAgentConfiguredException(String provider) {
        super("no agent configured to handle messages from " + provider);
    }
}
