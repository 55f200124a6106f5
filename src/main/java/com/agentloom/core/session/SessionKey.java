package com.agentloom.core.session;

/**
 * Identity of one session inside a store.
 */
record SessionKey(String appName, String userId, String sessionId) {

    static SessionKey of(Session session) {
        return new SessionKey(session.appName(), session.userId(), session.id());
    }
}
