package com.agentloom.core.agents;

/**
 * Base failure of agent execution. Raised through the invocation's event stream;
 * events committed before the failure stay committed.
 */
public class AgentExecutionException extends RuntimeException {

    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
