package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.stream.EventStream;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Runs its sub-agents concurrently and merges their events into one stream.
 * <p>
 * Each child gets its own branch, {@code <parent branch or own name>.<child name>}, which
 * hides sibling conversation history from it; session state stays shared. Events of one
 * child keep their order, events of different children interleave in arrival order.
 * A child is resumed only after its previous event was committed. A failing child does
 * not stop its siblings; once all have finished the failures are raised together as a
 * {@link ParallelExecutionException}.
 */
public final class ParallelAgent extends BaseAgent {

    public ParallelAgent(String name, List<? extends BaseAgent> subAgents) {
        this(name, "", subAgents, List.of(), List.of());
    }

    public ParallelAgent(String name, String description, List<? extends BaseAgent> subAgents,
                         List<BeforeAgentCallback> beforeAgentCallbacks,
                         List<AfterAgentCallback> afterAgentCallbacks) {
        super(name, description, subAgents, beforeAgentCallbacks, afterAgentCallbacks);
    }

    @Override
    protected EventStream runImpl(InvocationContext ctx) {
        String parentBranch = ctx.branch() == null ? name() : ctx.branch();
        var branches = new LinkedHashMap<String, BaseAgent>();
        for (BaseAgent child : subAgents()) {
            branches.put(parentBranch + "." + child.name(), child);
        }
        return new ParallelMergeStream(name(), ctx, branches);
    }
}
