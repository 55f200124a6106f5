package com.agentloom.core.callbacks;

import com.agentloom.core.agents.CallbackContext;
import com.agentloom.core.model.Content;

import java.util.Optional;

/**
 * Runs before an agent's own logic. Returning content skips the agent; the content
 * becomes the agent's only event.
 */
@FunctionalInterface
public interface BeforeAgentCallback {

    Optional<Content> beforeAgent(CallbackContext context) throws Exception;
}
