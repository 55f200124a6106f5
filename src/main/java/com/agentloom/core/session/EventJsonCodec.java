package com.agentloom.core.session;

import com.agentloom.core.model.Content;
import com.agentloom.core.model.EventActions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of the parts of an event and of state partitions stored in text columns.
 * <p>
 * Actions are written as {@code {stateDelta, removedKeys, artifactDelta, escalate, skipSummarization}};
 * tombstones are listed in {@code removedKeys} instead of appearing as values.
 */
final class EventJsonCodec {

    private final ObjectMapper objectMapper;

    EventJsonCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    String writeContent(Content content) {
        if (content == null) {
            return null;
        }
        return write(content, "event content");
    }

    Content readContent(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Content.class);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to deserialize event content", e);
        }
    }

    String writeActions(EventActions actions) {
        var values = new LinkedHashMap<String, Object>();
        var removed = new ArrayList<String>();
        actions.stateDelta().forEach((k, v) -> {
            if (v == State.REMOVED) {
                removed.add(k);
            } else {
                values.put(k, v);
            }
        });
        var doc = new StoredActions(values, removed, actions.artifactDelta(),
                actions.escalate(), actions.skipSummarization());
        return write(doc, "event actions");
    }

    EventActions readActions(String json) {
        if (json == null) {
            return EventActions.empty();
        }
        try {
            StoredActions doc = objectMapper.readValue(json, StoredActions.class);
            var builder = EventActions.builder()
                    .escalate(doc.escalate())
                    .skipSummarization(doc.skipSummarization());
            if (doc.stateDelta() != null) {
                doc.stateDelta().forEach(builder::putState);
            }
            if (doc.removedKeys() != null) {
                doc.removedKeys().forEach(builder::removeState);
            }
            if (doc.artifactDelta() != null) {
                doc.artifactDelta().forEach(builder::putArtifact);
            }
            return builder.build();
        } catch (IOException e) {
            throw new SessionStoreException("Failed to deserialize event actions", e);
        }
    }

    String writeState(Map<String, Object> state) {
        return write(state, "state");
    }

    Map<String, Object> readState(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (IOException e) {
            throw new SessionStoreException("Failed to deserialize state", e);
        }
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize " + what, e);
        }
    }

    record StoredActions(
        Map<String, Object> stateDelta,
        List<String> removedKeys,
        Map<String, Integer> artifactDelta,
        boolean escalate,
        boolean skipSummarization
    ) {}
}
