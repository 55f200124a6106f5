package com.agentloom.core.tools;

import com.agentloom.core.agents.CallbackContext;
import com.agentloom.core.agents.InvocationContext;
import com.agentloom.core.memory.MemoryService;
import com.agentloom.core.memory.SearchMemoryResponse;
import com.agentloom.core.model.EventActions;

/**
 * {@link CallbackContext} for a single tool call.
 */
public class ToolContext extends CallbackContext {

    private final String functionCallId;

    public ToolContext(InvocationContext invocationContext, EventActions.Builder actions, String functionCallId) {
        super(invocationContext, actions);
        this.functionCallId = functionCallId;
    }

    public String functionCallId() {
        return functionCallId;
    }

    public SearchMemoryResponse searchMemory(String query) {
        MemoryService memory = invocationContext.memoryService();
        if (memory == null) {
            throw new IllegalStateException("No memory service configured for this invocation");
        }
        var session = invocationContext.session();
        return memory.searchMemory(session.appName(), session.userId(), query);
    }
}
