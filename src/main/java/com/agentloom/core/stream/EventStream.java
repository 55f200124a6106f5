package com.agentloom.core.stream;

import com.agentloom.core.model.Event;

import java.util.Iterator;

/**
 * A lazy, pull-based sequence of events.
 * <p>
 * The producer only advances when the consumer calls {@link #hasNext()}: an event
 * returned by {@link #next()} is fully handled by the consumer before any code behind
 * it resumes. Closing the stream cancels the producer; closing twice is harmless.
 */
public interface EventStream extends Iterator<Event>, AutoCloseable {

    @Override
    void close();
}
