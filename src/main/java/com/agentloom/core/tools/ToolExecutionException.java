package com.agentloom.core.tools;

import com.agentloom.core.agents.AgentExecutionException;

/**
 * Wraps a checked failure thrown by a tool.
 */
public class ToolExecutionException extends AgentExecutionException {

    public ToolExecutionException(String toolName, Throwable cause) {
        super("Tool '" + toolName + "' failed: " + cause.getMessage(), cause);
    }
}
