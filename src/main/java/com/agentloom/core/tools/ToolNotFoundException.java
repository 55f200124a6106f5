package com.agentloom.core.tools;

import com.agentloom.core.agents.AgentExecutionException;

public class ToolNotFoundException extends AgentExecutionException {

    public ToolNotFoundException(String agentName, String toolName) {
        super("Agent '" + agentName + "' has no tool named '" + toolName + "'");
    }
}
