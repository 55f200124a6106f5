package com.agentloom.core.session;

import com.agentloom.core.model.EventActions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read/write view of session state used by callbacks and tools while a step is running.
 * <p>
 * Reads see the step's own pending writes before the committed session state, so code
 * running earlier in the same step can observe uncommitted values. Writes only go into
 * the pending delta; they take effect once the event carrying the delta is committed.
 */
public final class State {

    /** Tombstone marker: a delta entry with this value deletes the key from its scope. */
    public static final Object REMOVED = Tombstone.INSTANCE;

    public static final String APP_PREFIX = StateScope.APP.prefix();
    public static final String USER_PREFIX = StateScope.USER.prefix();
    public static final String TEMP_PREFIX = StateScope.TEMP.prefix();

    private final Map<String, Object> committed;
    private final EventActions.Builder pending;

    public State(Map<String, Object> committed, EventActions.Builder pending) {
        this.committed = Objects.requireNonNull(committed, "committed state must not be null");
        this.pending = Objects.requireNonNull(pending, "pending actions must not be null");
    }

    public Object get(String key) {
        Map<String, Object> delta = pending.stateDelta();
        if (delta.containsKey(key)) {
            Object value = delta.get(key);
            return value == REMOVED ? null : value;
        }
        return committed.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> value(String key) {
        return Optional.ofNullable((T) get(key));
    }

    public Object getOrDefault(String key, Object defaultValue) {
        Object value = get(key);
        return value != null ? value : defaultValue;
    }

    public boolean containsKey(String key) {
        return get(key) != null;
    }

    /**
     * Records a write in the pending delta after validating key and value.
     */
    public void put(String key, Object value) {
        StateValues.validate(key, value);
        pending.putState(key, value);
    }

    public void remove(String key) {
        StateScope.of(key);
        pending.removeState(key);
    }

    public boolean hasDelta() {
        return !pending.stateDelta().isEmpty();
    }

    /**
     * Snapshot of committed state with pending writes applied.
     */
    public Map<String, Object> toMap() {
        var merged = new LinkedHashMap<>(committed);
        pending.stateDelta().forEach((k, v) -> {
            if (v == REMOVED) {
                merged.remove(k);
            } else {
                merged.put(k, v);
            }
        });
        return merged;
    }

    private enum Tombstone {
        INSTANCE;

        @Override
        public String toString() {
            return "<removed>";
        }
    }
}
