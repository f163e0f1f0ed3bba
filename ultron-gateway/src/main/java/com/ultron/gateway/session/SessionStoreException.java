package com.ultron.gateway.session;

/**
 * Session index or transcript IO failed after retries.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
