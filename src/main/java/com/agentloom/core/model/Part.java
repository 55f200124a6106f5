package com.agentloom.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Map;

/**
 * One piece of a {@link Content}. Exactly one of the fields is set.
 *
 * @param text             plain text
 * @param functionCall     structured call requested by the model
 * @param functionResponse result of a tool call
 * @param inlineData       binary payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Part(
    String text,
    FunctionCall functionCall,
    FunctionResponse functionResponse,
    Blob inlineData
) implements Serializable {

    public static Part fromText(String text) {
        return new Part(text, null, null, null);
    }

    public static Part fromFunctionCall(String id, String name, Map<String, Object> args) {
        return new Part(null, new FunctionCall(id, name, args), null, null);
    }

    public static Part fromFunctionResponse(String id, String name, Map<String, Object> response) {
        return new Part(null, null, new FunctionResponse(id, name, response), null);
    }

    public static Part fromBytes(byte[] data, String mimeType) {
        return new Part(null, null, null, new Blob(mimeType, data));
    }
}
