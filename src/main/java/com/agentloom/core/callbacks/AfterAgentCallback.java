package com.agentloom.core.callbacks;

import com.agentloom.core.agents.CallbackContext;
import com.agentloom.core.model.Content;

import java.util.Optional;

/**
 * Runs after an agent's own logic. Returned content is appended as one more event.
 */
@FunctionalInterface
public interface AfterAgentCallback {

    Optional<Content> afterAgent(CallbackContext context) throws Exception;
}
