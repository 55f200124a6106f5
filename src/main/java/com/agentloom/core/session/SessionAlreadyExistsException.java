package com.agentloom.core.session;

public class SessionAlreadyExistsException extends RuntimeException {

    public SessionAlreadyExistsException(String appName, String userId, String sessionId) {
        super("Session already exists: app=" + appName + ", user=" + userId + ", id=" + sessionId);
    }
}
