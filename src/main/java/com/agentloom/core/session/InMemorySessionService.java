package com.agentloom.core.session;

import com.agentloom.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Volatile {@link SessionService}: all sessions and scoped state live in maps owned by
 * this instance and are lost with it. Suitable for tests and single-process tools.
 */
public class InMemorySessionService extends AbstractSessionService {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionService.class);

    private final Map<String, Map<String, Object>> appState = new HashMap<>();
    private final Map<UserKey, Map<String, Object>> userState = new HashMap<>();
    private final Map<UserKey, LinkedHashMap<String, StoredSession>> sessions = new HashMap<>();

    @Override
    public synchronized Session createSession(String appName, String userId,
                                              Map<String, Object> initialState, String sessionId) {
        validateIdentity(appName, userId);
        Map<String, Object> initial = initialState == null ? Map.of() : initialState;
        StateValues.validateAll(initial);

        String id = sessionId != null && !sessionId.isBlank() ? sessionId.trim() : UUID.randomUUID().toString();
        var userKey = new UserKey(appName, userId);
        var userSessions = sessions.computeIfAbsent(userKey, k -> new LinkedHashMap<>());
        if (userSessions.containsKey(id)) {
            throw new SessionAlreadyExistsException(appName, userId, id);
        }

        var delta = ScopedDelta.route(initial);
        applyTo(appState.computeIfAbsent(appName, k -> new HashMap<>()), delta.app());
        applyTo(userState.computeIfAbsent(userKey, k -> new HashMap<>()), delta.user());

        var stored = new StoredSession(new HashMap<>(), new ArrayList<>(), Instant.now());
        applyTo(stored.state, delta.session());
        userSessions.put(id, stored);

        log.info("Created session {} for app '{}' user '{}'", id, appName, userId);
        return toSession(appName, userId, id, stored, GetSessionConfig.all());
    }

    @Override
    public synchronized Optional<Session> getSession(String appName, String userId, String sessionId,
                                                     GetSessionConfig config) {
        var userSessions = sessions.get(new UserKey(appName, userId));
        if (userSessions == null || !userSessions.containsKey(sessionId)) {
            return Optional.empty();
        }
        return Optional.of(toSession(appName, userId, sessionId, userSessions.get(sessionId), config));
    }

    @Override
    public synchronized List<String> listSessionIds(String appName, String userId) {
        var userSessions = sessions.get(new UserKey(appName, userId));
        return userSessions == null ? List.of() : List.copyOf(userSessions.keySet());
    }

    @Override
    public synchronized void deleteSession(String appName, String userId, String sessionId) {
        var userSessions = sessions.get(new UserKey(appName, userId));
        if (userSessions != null && userSessions.remove(sessionId) != null) {
            log.info("Deleted session {} for app '{}' user '{}'", sessionId, appName, userId);
        }
        releaseLock(new SessionKey(appName, userId, sessionId));
    }

    @Override
    protected synchronized void persistEvent(SessionKey key, Event event, ScopedDelta delta, Instant updateTime) {
        var userKey = new UserKey(key.appName(), key.userId());
        var userSessions = sessions.get(userKey);
        StoredSession stored = userSessions == null ? null : userSessions.get(key.sessionId());
        if (stored == null) {
            throw new SessionNotFoundException(key.appName(), key.userId(), key.sessionId());
        }
        applyTo(appState.computeIfAbsent(key.appName(), k -> new HashMap<>()), delta.app());
        applyTo(userState.computeIfAbsent(userKey, k -> new HashMap<>()), delta.user());
        applyTo(stored.state, delta.session());
        stored.events.add(event);
        stored.lastUpdateTime = updateTime;
    }

    private Session toSession(String appName, String userId, String id, StoredSession stored,
                              GetSessionConfig config) {
        Map<String, Object> merged = mergeState(
                appState.getOrDefault(appName, Map.of()),
                userState.getOrDefault(new UserKey(appName, userId), Map.of()),
                stored.state);
        return new Session(id, appName, userId, merged,
                filterEvents(List.copyOf(stored.events), config), stored.lastUpdateTime);
    }

    private record UserKey(String appName, String userId) {}

    private static final class StoredSession {
        final Map<String, Object> state;
        final List<Event> events;
        Instant lastUpdateTime;

        StoredSession(Map<String, Object> state, List<Event> events, Instant lastUpdateTime) {
            this.state = state;
            this.events = events;
            this.lastUpdateTime = lastUpdateTime;
        }
    }
}
