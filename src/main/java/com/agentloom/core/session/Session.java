package com.agentloom.core.session;

import com.agentloom.core.model.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One conversation thread: identity, append-only event history and the flattened state view.
 * <p>
 * {@link #state()} presents all scopes as one map: session keys without prefix,
 * user/app/temp keys with their prefix. Application code never mutates a session
 * directly; only a {@link SessionService} does, through {@code appendEvent}.
 * Reads are safe from concurrently running parallel branches.
 */
public final class Session {

    private final String id;
    private final String appName;
    private final String userId;
    private final ConcurrentHashMap<String, Object> state;
    private final List<Event> events;
    private volatile Instant lastUpdateTime;

    Session(String id, String appName, String userId,
            Map<String, Object> state, List<Event> events, Instant lastUpdateTime) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.appName = Objects.requireNonNull(appName, "appName must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.state = new ConcurrentHashMap<>();
        state.forEach((key, value) -> this.state.put(key, StateValues.freeze(value)));
        this.events = new ArrayList<>(events);
        this.lastUpdateTime = lastUpdateTime;
    }

    public String id() {
        return id;
    }

    public String appName() {
        return appName;
    }

    public String userId() {
        return userId;
    }

    /** Live read-only view of the merged state. */
    public Map<String, Object> state() {
        return Collections.unmodifiableMap(state);
    }

    /** Snapshot of the event history in commit order. */
    public List<Event> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public int eventCount() {
        synchronized (events) {
            return events.size();
        }
    }

    public Instant lastUpdateTime() {
        return lastUpdateTime;
    }

    // ── Mutators reserved for session services ───────────────────────

    void applyDelta(Map<String, Object> delta) {
        delta.forEach((key, value) -> {
            if (value == State.REMOVED) {
                state.remove(key);
            } else {
                state.put(key, value);
            }
        });
    }

    void appendEvent(Event event) {
        synchronized (events) {
            events.add(event);
        }
    }

    void touch(Instant time) {
        this.lastUpdateTime = time;
    }

    @Override
    public String toString() {
        return "Session[app=" + appName + ", user=" + userId + ", id=" + id
                + ", events=" + eventCount() + ", keys=" + state.keySet() + "]";
    }
}
