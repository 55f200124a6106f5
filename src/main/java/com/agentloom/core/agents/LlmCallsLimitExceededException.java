package com.agentloom.core.agents;

public class LlmCallsLimitExceededException extends AgentExecutionException {

    public LlmCallsLimitExceededException(int limit) {
        super("Maximum number of model calls (" + limit + ") exceeded for this invocation");
    }
}
