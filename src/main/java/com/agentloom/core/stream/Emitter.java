package com.agentloom.core.stream;

import com.agentloom.core.model.Event;

/**
 * Sink a {@link Generator} yields events into.
 */
@FunctionalInterface
public interface Emitter {

    /**
     * Hands the event to the consumer and suspends until the consumer asks for the next one.
     *
     * @throws GeneratorCancelledException if the consuming stream was closed meanwhile
     */
    void emit(Event event);
}
