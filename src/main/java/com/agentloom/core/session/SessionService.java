package com.agentloom.core.session;

import com.agentloom.core.model.Event;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages sessions and durably applies the mutations carried by committed events.
 * Implementations: {@link InMemorySessionService} (volatile), {@link JdbcSessionService} (relational).
 */
public interface SessionService {

    /**
     * Creates a session.
     *
     * @param initialState optional initial state; keys are routed by scope prefix, {@code temp:} keys are dropped
     * @param sessionId    optional id; a random UUID is used when null
     * @throws SessionAlreadyExistsException if the id is taken
     * @throws SessionValidationException    if a key or value of the initial state is invalid
     */
    Session createSession(String appName, String userId, Map<String, Object> initialState, String sessionId);

    default Session createSession(String appName, String userId) {
        return createSession(appName, userId, null, null);
    }

    /**
     * Loads a fresh copy of a session, with the merged state of all durable scopes.
     */
    Optional<Session> getSession(String appName, String userId, String sessionId, GetSessionConfig config);

    default Optional<Session> getSession(String appName, String userId, String sessionId) {
        return getSession(appName, userId, sessionId, GetSessionConfig.all());
    }

    /**
     * Ids of the user's sessions in creation order.
     */
    List<String> listSessionIds(String appName, String userId);

    /**
     * Deletes a session and its event log. Deleting an absent session is a no-op.
     */
    void deleteSession(String appName, String userId, String sessionId);

    /**
     * Commits an event: applies its state delta by scope and appends it to the history.
     * This is the only way session state changes. Calls for the same session are
     * serialised; partial events are ignored.
     *
     * @return the updated session object that was passed in
     * @throws SessionValidationException if the event or its delta is malformed
     * @throws SessionNotFoundException   if the session no longer exists in the store
     */
    Session appendEvent(Session session, Event event);
}
