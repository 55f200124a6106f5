package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.stream.EventStream;

import java.util.List;

/**
 * Runs its sub-agents in order, repeatedly, with the same context.
 * <p>
 * Stops after {@code maxIterations} full passes (0 means no limit), or immediately after
 * any forwarded event carries {@code escalate=true}; the remaining children of that pass
 * do not run. A failing child ends the loop and the failure propagates.
 */
public final class LoopAgent extends BaseAgent {

    private final int maxIterations;

    public LoopAgent(String name, List<? extends BaseAgent> subAgents, int maxIterations) {
        this(name, "", subAgents, maxIterations, List.of(), List.of());
    }

    public LoopAgent(String name, String description, List<? extends BaseAgent> subAgents, int maxIterations,
                     List<BeforeAgentCallback> beforeAgentCallbacks,
                     List<AfterAgentCallback> afterAgentCallbacks) {
        super(name, description, checkIterations(maxIterations, subAgents), beforeAgentCallbacks, afterAgentCallbacks);
        this.maxIterations = maxIterations;
    }

    // runs before the children are attached, so a rejected loop leaves them unparented
    private static List<? extends BaseAgent> checkIterations(int maxIterations, List<? extends BaseAgent> subAgents) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative: " + maxIterations);
        }
        return subAgents;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    protected EventStream runImpl(InvocationContext ctx) {
        return new ChildSequenceStream(ctx, subAgents(), maxIterations, true);
    }
}
