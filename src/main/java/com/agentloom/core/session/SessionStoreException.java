package com.agentloom.core.session;

/**
 * Wraps failures of the persistence backend (JDBC, serialisation).
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
