package com.agentloom.core.model;

import com.agentloom.core.session.State;
import com.agentloom.core.session.StateValues;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side effects an {@link Event} asks the runtime to apply when it is committed.
 *
 * @param stateDelta        state key to new value, or {@link State#REMOVED} to delete the key
 * @param artifactDelta     artifact filename to the version saved during this step
 * @param escalate          asks the enclosing loop to terminate
 * @param skipSummarization hint for callers to skip default post-processing of a tool result
 */
public record EventActions(
    Map<String, Object> stateDelta,
    Map<String, Integer> artifactDelta,
    boolean escalate,
    boolean skipSummarization
) implements Serializable {

    private static final EventActions EMPTY = new EventActions(Map.of(), Map.of(), false, false);

    public EventActions {
        stateDelta = stateDelta == null ? Map.of() : frozenCopy(stateDelta);
        artifactDelta = artifactDelta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifactDelta));
    }

    private static Map<String, Object> frozenCopy(Map<String, Object> delta) {
        var copy = new LinkedHashMap<String, Object>();
        delta.forEach((key, value) -> copy.put(key, StateValues.freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    public static EventActions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EventActions ofStateDelta(Map<String, Object> stateDelta) {
        return new EventActions(stateDelta, Map.of(), false, false);
    }

    public boolean isEmpty() {
        return stateDelta.isEmpty() && artifactDelta.isEmpty() && !escalate && !skipSummarization;
    }

    /**
     * Combines actions in order: later deltas override earlier ones key by key, flags are OR-ed.
     */
    public static EventActions merge(List<EventActions> actions) {
        var builder = builder();
        for (EventActions a : actions) {
            builder.mergeFrom(a);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return builder().mergeFrom(this);
    }

    /**
     * Mutable accumulator used while a step is still running (callbacks, tools).
     * Not thread-safe; each context owns its own builder.
     */
    public static final class Builder {

        private final Map<String, Object> stateDelta = new LinkedHashMap<>();
        private final Map<String, Integer> artifactDelta = new LinkedHashMap<>();
        private boolean escalate;
        private boolean skipSummarization;

        private Builder() {}

        public Builder putState(String key, Object value) {
            stateDelta.put(key, value);
            return this;
        }

        public Builder removeState(String key) {
            stateDelta.put(key, State.REMOVED);
            return this;
        }

        public Builder putArtifact(String filename, int version) {
            artifactDelta.put(filename, version);
            return this;
        }

        public Builder escalate(boolean escalate) {
            this.escalate = escalate;
            return this;
        }

        public Builder skipSummarization(boolean skipSummarization) {
            this.skipSummarization = skipSummarization;
            return this;
        }

        public Builder mergeFrom(EventActions other) {
            stateDelta.putAll(other.stateDelta());
            artifactDelta.putAll(other.artifactDelta());
            escalate |= other.escalate();
            skipSummarization |= other.skipSummarization();
            return this;
        }

        /** Live view of the pending state delta. */
        public Map<String, Object> stateDelta() {
            return stateDelta;
        }

        public boolean isEscalate() {
            return escalate;
        }

        public boolean isSkipSummarization() {
            return skipSummarization;
        }

        public boolean isEmpty() {
            return stateDelta.isEmpty() && artifactDelta.isEmpty() && !escalate && !skipSummarization;
        }

        public EventActions build() {
            return new EventActions(stateDelta, artifactDelta, escalate, skipSummarization);
        }
    }
}
