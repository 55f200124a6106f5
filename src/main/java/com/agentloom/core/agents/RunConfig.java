package com.agentloom.core.agents;

/**
 * Per-invocation run options.
 *
 * @param streamingMode whether partial model output is forwarded
 * @param maxLlmCalls   model-call limit shared by all agents of the invocation; zero or less disables the limit
 */
public record RunConfig(StreamingMode streamingMode, int maxLlmCalls) {

    public static final int DEFAULT_MAX_LLM_CALLS = 500;

    public RunConfig {
        streamingMode = streamingMode == null ? StreamingMode.NONE : streamingMode;
    }

    public static RunConfig defaults() {
        return new RunConfig(StreamingMode.NONE, DEFAULT_MAX_LLM_CALLS);
    }

    public RunConfig withStreamingMode(StreamingMode mode) {
        return new RunConfig(mode, maxLlmCalls);
    }

    public RunConfig withMaxLlmCalls(int max) {
        return new RunConfig(streamingMode, max);
    }
}
