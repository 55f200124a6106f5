package com.agentloom.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fans {@link RunnerEvent}s out to in-process listeners.
 * <p>
 * Every listener carries a filter; {@link #subscribeToSession} and {@link #subscribeToInvocation}
 * are shorthands for the common ones. An invocation listener removes itself once that
 * invocation's terminal notification has been delivered. Listeners run on the publishing
 * thread, in subscription order. A listener that throws is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(RunnerEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        log.debug("Publishing {} for invocation {}", event.eventType(), event.invocationId());
        for (Listener listener : listeners) {
            if (!listener.filter.test(event)) {
                continue;
            }
            listener.deliver(event);
            if (listener.untilTerminal && event.isTerminal()) {
                listeners.remove(listener);
            }
        }
    }

    /** Receives every published notification matching {@code filter}. */
    public Subscription subscribe(Predicate<? super RunnerEvent> filter, Consumer<? super RunnerEvent> consumer) {
        return register(new Listener(filter, consumer, false));
    }

    public Subscription subscribeAll(Consumer<? super RunnerEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public Subscription subscribeToSession(String sessionId, Consumer<? super RunnerEvent> consumer) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return subscribe(event -> sessionId.equals(event.sessionId()), consumer);
    }

    /**
     * Receives the notifications of one invocation, up to and including its completed,
     * ended or failed notification, then unsubscribes itself.
     */
    public Subscription subscribeToInvocation(String invocationId, Consumer<? super RunnerEvent> consumer) {
        Objects.requireNonNull(invocationId, "invocationId must not be null");
        return register(new Listener(event -> invocationId.equals(event.invocationId()), consumer, true));
    }

    /** Number of live subscriptions. */
    public int listenerCount() {
        return listeners.size();
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Handle for a registered listener; closing it more than once is harmless. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Listener {

        private final Predicate<? super RunnerEvent> filter;
        private final Consumer<? super RunnerEvent> consumer;
        private final boolean untilTerminal;

        private Listener(Predicate<? super RunnerEvent> filter, Consumer<? super RunnerEvent> consumer,
                         boolean untilTerminal) {
            this.filter = Objects.requireNonNull(filter, "filter must not be null");
            this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
            this.untilTerminal = untilTerminal;
        }

        private void deliver(RunnerEvent event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for invocation {}: {}",
                        event.eventType(), event.invocationId(), e.getMessage(), e);
            }
        }
    }
}
