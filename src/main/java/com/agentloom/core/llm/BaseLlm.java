package com.agentloom.core.llm;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * A reasoning model the runtime can call. Implementations translate an {@link LlmRequest}
 * into a provider call and the provider output back into {@link LlmResponse}s.
 */
public abstract class BaseLlm {

    private final String model;

    protected BaseLlm(String model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    public String model() {
        return model;
    }

    /**
     * Calls the model.
     *
     * @param stream when true the implementation may return partial responses before the final one
     * @return the responses in order; the last one is final (not partial)
     */
    public abstract Stream<LlmResponse> generateContent(LlmRequest request, boolean stream);
}
