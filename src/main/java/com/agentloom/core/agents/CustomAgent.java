package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.stream.EventStream;

import java.util.List;

/**
 * Base class for user-defined agents. Subclasses implement {@link #runImpl} and usually
 * build their stream with {@link com.agentloom.core.stream.EventStreams#generate}, running
 * sub-agents through their {@code run} method.
 */
public abstract non-sealed class CustomAgent extends BaseAgent {

    protected CustomAgent(String name, String description) {
        this(name, description, List.of(), List.of(), List.of());
    }

    protected CustomAgent(String name, String description, List<? extends BaseAgent> subAgents,
                          List<BeforeAgentCallback> beforeAgentCallbacks,
                          List<AfterAgentCallback> afterAgentCallbacks) {
        super(name, description, subAgents, beforeAgentCallbacks, afterAgentCallbacks);
    }

    @Override
    protected abstract EventStream runImpl(InvocationContext ctx);
}
