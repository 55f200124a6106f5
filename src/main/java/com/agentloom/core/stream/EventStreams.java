package com.agentloom.core.stream;

import com.agentloom.core.model.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Factory methods for {@link EventStream}s.
 */
public final class EventStreams {

    private EventStreams() {}

    public static EventStream empty() {
        return of(List.of());
    }

    public static EventStream of(Event... events) {
        return of(Arrays.asList(events));
    }

    public static EventStream of(List<Event> events) {
        var copy = List.copyOf(events);
        return new EventStream() {
            private int index;
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && index < copy.size();
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return copy.get(index++);
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    /**
     * Stream whose source is only created on the first {@code hasNext()}.
     */
    public static EventStream defer(Supplier<EventStream> supplier) {
        return concat(List.of(supplier));
    }

    /**
     * Runs the sources one after another. Each source is created lazily once the previous
     * one is exhausted, so it observes every effect committed before it.
     */
    public static EventStream concat(List<Supplier<EventStream>> sources) {
        return new ConcatStream(List.copyOf(sources));
    }

    @SafeVarargs
    public static EventStream concat(Supplier<EventStream>... sources) {
        return concat(Arrays.asList(sources));
    }

    /**
     * Stream produced by straight-line generator code running on the executor.
     * The executor must not bound the number of threads below the nesting depth of
     * generated streams.
     */
    public static EventStream generate(Executor executor, Generator body) {
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(body, "generator must not be null");
        return new GeneratorStream(executor, body);
    }

    /**
     * Drains the stream into a list and closes it.
     */
    public static List<Event> toList(EventStream stream) {
        var events = new ArrayList<Event>();
        try (stream) {
            while (stream.hasNext()) {
                events.add(stream.next());
            }
        }
        return events;
    }

    private static final class ConcatStream implements EventStream {

        private final List<Supplier<EventStream>> sources;
        private int nextSource;
        private EventStream current;
        private boolean closed;

        ConcatStream(List<Supplier<EventStream>> sources) {
            this.sources = sources;
        }

        @Override
        public boolean hasNext() {
            while (!closed) {
                if (current != null && current.hasNext()) {
                    return true;
                }
                if (current != null) {
                    current.close();
                    current = null;
                }
                if (nextSource >= sources.size()) {
                    closed = true;
                    return false;
                }
                current = Objects.requireNonNull(sources.get(nextSource++).get(), "event source returned null");
            }
            return false;
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        @Override
        public void close() {
            closed = true;
            if (current != null) {
                current.close();
                current = null;
            }
        }
    }
}
