package com.agentloom.core.session;

import com.agentloom.core.model.Event;
import com.agentloom.core.model.EventActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Commit protocol shared by all session backends.
 * <p>
 * {@link #appendEvent} validates the event, serialises commits per session, strips
 * {@code temp:} keys from the stored copy and hands the routed delta to the backend
 * via {@link #persistEvent}. Only after the backend succeeded is the caller's session
 * object updated, so a failed commit leaves it untouched.
 */
public abstract class AbstractSessionService implements SessionService {

    private static final Logger log = LoggerFactory.getLogger(AbstractSessionService.class);

    private final ConcurrentHashMap<SessionKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public final Session appendEvent(Session session, Event event) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(event, "event must not be null");

        if (event.partial()) {
            log.debug("Skipping partial event {} from '{}'", event.id(), event.author());
            return session;
        }

        validateEvent(event);

        var key = SessionKey.of(session);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Instant now = Instant.now();
            persistEvent(key, withoutTempState(event), ScopedDelta.route(event.actions().stateDelta()), now);

            session.applyDelta(event.actions().stateDelta());
            session.appendEvent(event);
            session.touch(now);
        } finally {
            lock.unlock();
        }

        log.debug("Committed event {} from '{}' to session {} ({} delta keys)",
                event.id(), event.author(), session.id(), event.actions().stateDelta().size());
        return session;
    }

    /**
     * Writes the event and its routed delta to the backend atomically.
     *
     * @param event  the event as it must be stored ({@code temp:} keys already removed)
     * @param delta  the durable part of the delta, split by scope with prefixes stripped
     * @throws SessionNotFoundException if the session does not exist in the backend
     */
    protected abstract void persistEvent(SessionKey key, Event event, ScopedDelta delta, Instant updateTime);

    /** Drops the commit lock of a deleted session. */
    protected void releaseLock(SessionKey key) {
        locks.remove(key);
    }

    // ── Validation ───────────────────────────────────────────────────────

    static void validateEvent(Event event) {
        if (isBlank(event.id())) {
            throw new SessionValidationException("Event id must not be blank");
        }
        if (isBlank(event.author())) {
            throw new SessionValidationException("Event " + event.id() + " has no author");
        }
        if (isBlank(event.invocationId())) {
            throw new SessionValidationException("Event " + event.id() + " has no invocation id");
        }
        if (event.timestamp() == null) {
            throw new SessionValidationException("Event " + event.id() + " has no timestamp");
        }
        StateValues.validateAll(event.actions().stateDelta());
    }

    static void validateIdentity(String appName, String userId) {
        if (isBlank(appName)) {
            throw new SessionValidationException("appName must not be blank");
        }
        if (isBlank(userId)) {
            throw new SessionValidationException("userId must not be blank");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // ── State helpers ────────────────────────────────────────────────────

    static Event withoutTempState(Event event) {
        Map<String, Object> delta = event.actions().stateDelta();
        if (delta.keySet().stream().noneMatch(k -> StateScope.of(k) == StateScope.TEMP)) {
            return event;
        }
        var durable = new LinkedHashMap<String, Object>();
        delta.forEach((k, v) -> {
            if (StateScope.of(k).isDurable()) {
                durable.put(k, v);
            }
        });
        var actions = new EventActions(durable, event.actions().artifactDelta(),
                event.actions().escalate(), event.actions().skipSummarization());
        return event.toBuilder().actions(actions).build();
    }

    /**
     * Applies a partition delta in place, honouring tombstones.
     */
    static void applyTo(Map<String, Object> target, Map<String, Object> delta) {
        delta.forEach((k, v) -> {
            if (v == State.REMOVED) {
                target.remove(k);
            } else {
                target.put(k, v);
            }
        });
    }

    /**
     * Builds the flattened view of all durable scopes, prefixes restored.
     */
    static Map<String, Object> mergeState(Map<String, Object> appState,
                                          Map<String, Object> userState,
                                          Map<String, Object> sessionState) {
        var merged = new HashMap<String, Object>(sessionState);
        appState.forEach((k, v) -> merged.put(StateScope.APP.qualify(k), v));
        userState.forEach((k, v) -> merged.put(StateScope.USER.qualify(k), v));
        return merged;
    }

    static List<Event> filterEvents(List<Event> events, GetSessionConfig config) {
        if (config == null) {
            return events;
        }
        List<Event> filtered = events;
        if (config.afterTimestamp() != null) {
            filtered = new ArrayList<>();
            for (Event e : events) {
                if (e.timestamp().isAfter(config.afterTimestamp())) {
                    filtered.add(e);
                }
            }
        }
        if (config.numRecentEvents() != null) {
            int n = Math.max(0, config.numRecentEvents());
            filtered = filtered.subList(Math.max(0, filtered.size() - n), filtered.size());
        }
        return filtered;
    }

    /**
     * A state delta split into its durable partitions, keys without scope prefix.
     * {@code temp:} keys are discarded.
     */
    protected record ScopedDelta(Map<String, Object> app,
                                 Map<String, Object> user,
                                 Map<String, Object> session) {

        static ScopedDelta route(Map<String, Object> delta) {
            var app = new LinkedHashMap<String, Object>();
            var user = new LinkedHashMap<String, Object>();
            var session = new LinkedHashMap<String, Object>();
            delta.forEach((key, raw) -> {
                StateScope scope = StateScope.of(key);
                Object value = StateValues.freeze(raw);
                switch (scope) {
                    case APP -> app.put(scope.strip(key), value);
                    case USER -> user.put(scope.strip(key), value);
                    case SESSION -> session.put(key, value);
                    case TEMP -> { }
                }
            });
            return new ScopedDelta(app, user, session);
        }

        boolean isEmpty() {
            return app.isEmpty() && user.isEmpty() && session.isEmpty();
        }
    }
}
