package com.agentloom.core.callbacks;

import com.agentloom.core.agents.CallbackContext;
import com.agentloom.core.llm.LlmRequest;
import com.agentloom.core.llm.LlmResponse;

import java.util.Optional;

/**
 * Runs before a model call; may edit the request in place. Returning a response replaces
 * the model call.
 */
@FunctionalInterface
public interface BeforeModelCallback {

    Optional<LlmResponse> beforeModel(CallbackContext context, LlmRequest request) throws Exception;
}
