package com.agentloom.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of a tool invocation, folded back into the conversation.
 *
 * @param id       id of the {@link FunctionCall} this answers (nullable)
 * @param name     name of the tool that produced the result
 * @param response result payload, never null
 */
public record FunctionResponse(
    String id,
    String name,
    Map<String, Object> response
) implements Serializable {

    public FunctionResponse {
        response = response == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(response));
    }
}
