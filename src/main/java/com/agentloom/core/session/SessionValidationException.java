package com.agentloom.core.session;

/**
 * Thrown at the session store boundary when an event, a state key or a state value is malformed.
 */
public class SessionValidationException extends RuntimeException {

    public SessionValidationException(String message) {
        super(message);
    }
}
