package com.agentloom.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured call requested by the reasoning model.
 *
 * @param id   call id used to pair the call with its {@link FunctionResponse} (nullable)
 * @param name name of the tool to invoke
 * @param args call arguments, never null
 */
public record FunctionCall(
    String id,
    String name,
    Map<String, Object> args
) implements Serializable {

    public FunctionCall {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
