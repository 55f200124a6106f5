package com.agentloom.core.session;

/**
 * Thrown when an operation targets a session that does not exist (never created or deleted).
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String appName, String userId, String sessionId) {
        super("Session not found: app=" + appName + ", user=" + userId + ", id=" + sessionId);
    }
}
