package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.stream.EventStream;

import java.util.List;

/**
 * Runs its sub-agents in order, each to completion, with the same context.
 * Events are forwarded unchanged; a failing child ends the sequence.
 */
public final class SequentialAgent extends BaseAgent {

    public SequentialAgent(String name, List<? extends BaseAgent> subAgents) {
        this(name, "", subAgents, List.of(), List.of());
    }

    public SequentialAgent(String name, String description, List<? extends BaseAgent> subAgents,
                           List<BeforeAgentCallback> beforeAgentCallbacks,
                           List<AfterAgentCallback> afterAgentCallbacks) {
        super(name, description, subAgents, beforeAgentCallbacks, afterAgentCallbacks);
    }

    @Override
    protected EventStream runImpl(InvocationContext ctx) {
        return new ChildSequenceStream(ctx, subAgents(), 1, false);
    }
}
