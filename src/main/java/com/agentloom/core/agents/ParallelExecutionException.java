package com.agentloom.core.agents;

import java.util.List;

/**
 * Raised by a parallel agent after all branches have finished when one or more of them
 * failed. The first failure is the cause, the rest are attached as suppressed exceptions.
 */
public class ParallelExecutionException extends AgentExecutionException {

    private final List<String> failedBranches;

    public ParallelExecutionException(String agentName, List<String> failedBranches, List<Throwable> failures) {
        super("Parallel agent '" + agentName + "' had " + failures.size() + " failed branch(es): " + failedBranches,
                failures.isEmpty() ? null : failures.get(0));
        this.failedBranches = List.copyOf(failedBranches);
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    public List<String> failedBranches() {
        return failedBranches;
    }
}
