package com.agentloom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Opaque message payload carried by an {@link Event}: a role plus an ordered list of parts.
 *
 * @param role  "user" for caller input and tool results, "model" for model output
 * @param parts ordered parts, never null
 */
public record Content(String role, List<Part> parts) implements Serializable {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    public Content {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static Content fromText(String role, String text) {
        return new Content(role, List.of(Part.fromText(text)));
    }

    public static Content userText(String text) {
        return fromText(ROLE_USER, text);
    }

    public static Content modelText(String text) {
        return fromText(ROLE_MODEL, text);
    }

    /**
     * Concatenated text of all text parts, or an empty string when there is none.
     */
    public String text() {
        return parts.stream()
                .map(Part::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
    }

    public List<FunctionCall> functionCalls() {
        return parts.stream()
                .map(Part::functionCall)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<FunctionResponse> functionResponses() {
        return parts.stream()
                .map(Part::functionResponse)
                .filter(Objects::nonNull)
                .toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return parts.isEmpty();
    }
}
