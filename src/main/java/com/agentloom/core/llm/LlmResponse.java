package com.agentloom.core.llm;

import com.agentloom.core.model.Content;

/**
 * One response, or one streamed fragment of a response, from a reasoning model.
 *
 * @param content      model output (text and/or function calls), null for pure error responses
 * @param partial      true for a streaming fragment that a later response completes
 * @param turnComplete true when the model ended its turn
 * @param errorCode    provider error code (nullable)
 * @param errorMessage provider error detail (nullable)
 */
public record LlmResponse(
    Content content,
    boolean partial,
    boolean turnComplete,
    String errorCode,
    String errorMessage
) {

    public static LlmResponse of(Content content) {
        return new LlmResponse(content, false, true, null, null);
    }

    public static LlmResponse text(String text) {
        return of(Content.modelText(text));
    }

    public static LlmResponse partialText(String text) {
        return new LlmResponse(Content.modelText(text), true, false, null, null);
    }

    public static LlmResponse error(String errorCode, String errorMessage) {
        return new LlmResponse(null, false, true, errorCode, errorMessage);
    }

    public boolean isError() {
        return errorCode != null;
    }
}
