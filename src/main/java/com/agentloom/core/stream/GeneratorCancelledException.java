package com.agentloom.core.stream;

/**
 * Thrown from {@link Emitter#emit} once the consumer has closed the stream; unwinds the
 * generator body. Generators must not swallow it.
 */
public class GeneratorCancelledException extends RuntimeException {

    public GeneratorCancelledException() {
        super("Event stream closed by consumer", null, false, false);
    }
}
