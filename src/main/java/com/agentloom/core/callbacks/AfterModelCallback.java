package com.agentloom.core.callbacks;

import com.agentloom.core.agents.CallbackContext;
import com.agentloom.core.llm.LlmResponse;

import java.util.Optional;

/**
 * Runs on the final model response; returning a response replaces it.
 */
@FunctionalInterface
public interface AfterModelCallback {

    Optional<LlmResponse> afterModel(CallbackContext context, LlmResponse response) throws Exception;
}
