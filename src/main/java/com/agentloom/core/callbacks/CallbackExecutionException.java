package com.agentloom.core.callbacks;

import com.agentloom.core.agents.AgentExecutionException;

/**
 * Wraps a checked failure thrown by a callback.
 */
public class CallbackExecutionException extends AgentExecutionException {

    public CallbackExecutionException(String phase, Throwable cause) {
        super(phase + " callback failed: " + cause.getMessage(), cause);
    }
}
