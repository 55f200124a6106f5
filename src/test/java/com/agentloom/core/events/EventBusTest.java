package com.agentloom.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RunnerEvent event(String type, String sessionId, String invocationId) {
        return new RunnerEvent(type, sessionId, invocationId, null, Map.of(), Instant.now());
    }

    private static List<String> types(List<RunnerEvent> events) {
        return events.stream().map(RunnerEvent::eventType).toList();
    }

    @Nested
    @DisplayName("filtered subscriptions")
    class Filtered {

        @Test
        @DisplayName("a session listener only sees its session")
        void sessionListener() {
            List<RunnerEvent> received = new ArrayList<>();
            eventBus.subscribeToSession("s-1", received::add);

            var committed = new RunnerEvent(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-1", "writer",
                    Map.of("eventId", "ev-1"), Instant.now());
            eventBus.publish(committed);
            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-2", "inv-2"));

            assertEquals(List.of(committed), received);
        }

        @Test
        @DisplayName("a custom filter selects by event type")
        void customFilter() {
            List<RunnerEvent> failures = new ArrayList<>();
            eventBus.subscribe(e -> RunnerEvent.INVOCATION_FAILED.equals(e.eventType()), failures::add);

            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));
            eventBus.publish(event(RunnerEvent.INVOCATION_FAILED, "s-1", "inv-1"));

            assertEquals(List.of(RunnerEvent.INVOCATION_FAILED), types(failures));
        }

        @Test
        @DisplayName("subscribeAll sees every session, in publish order")
        void everything() {
            List<RunnerEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));
            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-2", "inv-2"));
            eventBus.publish(event(RunnerEvent.INVOCATION_COMPLETED, "s-1", "inv-1"));

            assertEquals(List.of("s-1", "s-2", "s-1"), received.stream().map(RunnerEvent::sessionId).toList());
        }
    }

    @Nested
    @DisplayName("invocation subscriptions")
    class PerInvocation {

        @Test
        @DisplayName("receives one invocation up to its terminal notification, then detaches")
        void detachesAfterTerminal() {
            List<RunnerEvent> received = new ArrayList<>();
            eventBus.subscribeToInvocation("inv-1", received::add);
            assertEquals(1, eventBus.listenerCount());

            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));
            eventBus.publish(event(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-2"));
            eventBus.publish(event(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-1"));
            eventBus.publish(event(RunnerEvent.INVOCATION_ENDED, "s-1", "inv-1"));

            assertEquals(0, eventBus.listenerCount());
            eventBus.publish(event(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-1"));

            assertEquals(List.of(RunnerEvent.INVOCATION_STARTED, RunnerEvent.EVENT_COMMITTED,
                    RunnerEvent.INVOCATION_ENDED), types(received));
        }

        @Test
        @DisplayName("another invocation's terminal notification does not detach it")
        void otherInvocationTerminal() {
            eventBus.subscribeToInvocation("inv-1", e -> { });

            eventBus.publish(event(RunnerEvent.INVOCATION_FAILED, "s-1", "inv-2"));

            assertEquals(1, eventBus.listenerCount());
        }

        @Test
        @DisplayName("a listener that throws on the terminal notification is still detached")
        void throwingListenerDetached() {
            eventBus.subscribeToInvocation("inv-1", e -> {
                throw new IllegalStateException("boom");
            });

            assertDoesNotThrow(() -> eventBus.publish(event(RunnerEvent.INVOCATION_COMPLETED, "s-1", "inv-1")));
            assertEquals(0, eventBus.listenerCount());
        }
    }

    @Test
    @DisplayName("completed, ended and failed are terminal; started and committed are not")
    void terminalTypes() {
        assertTrue(event(RunnerEvent.INVOCATION_COMPLETED, "s", "i").isTerminal());
        assertTrue(event(RunnerEvent.INVOCATION_ENDED, "s", "i").isTerminal());
        assertTrue(event(RunnerEvent.INVOCATION_FAILED, "s", "i").isTerminal());
        assertFalse(event(RunnerEvent.INVOCATION_STARTED, "s", "i").isTerminal());
        assertFalse(event(RunnerEvent.EVENT_COMMITTED, "s", "i").isTerminal());
    }

    @Test
    @DisplayName("closing a subscription stops delivery and can be repeated")
    void closeStopsDelivery() {
        List<RunnerEvent> received = new ArrayList<>();
        EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

        eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));
        subscription.close();
        subscription.close();
        eventBus.publish(event(RunnerEvent.INVOCATION_COMPLETED, "s-1", "inv-1"));

        assertEquals(1, received.size());
        assertEquals(0, eventBus.listenerCount());
    }

    @Test
    @DisplayName("try-with-resources scopes a listener to a block")
    void tryWithResources() {
        List<RunnerEvent> received = new ArrayList<>();
        try (EventBus.Subscription ignored = eventBus.subscribeToSession("s-1", received::add)) {
            eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));
        }
        eventBus.publish(event(RunnerEvent.INVOCATION_COMPLETED, "s-1", "inv-1"));

        assertEquals(List.of(RunnerEvent.INVOCATION_STARTED), types(received));
    }

    @Test
    @DisplayName("the same consumer subscribed twice is delivered twice and closed independently")
    void duplicateConsumers() {
        List<RunnerEvent> received = new ArrayList<>();
        Consumer<RunnerEvent> consumer = received::add;
        EventBus.Subscription first = eventBus.subscribeAll(consumer);
        eventBus.subscribeAll(consumer);

        first.close();
        eventBus.publish(event(RunnerEvent.INVOCATION_STARTED, "s-1", "inv-1"));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("a failing listener does not keep the others from receiving")
    void failingListenerIsolated() {
        List<RunnerEvent> received = new ArrayList<>();
        eventBus.subscribeAll(e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-1")));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("concurrent publishers lose nothing")
    void concurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<RunnerEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeToSession("s-1", received::add);

        int threadCount = 8;
        int eventsPerThread = 50;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event(RunnerEvent.EVENT_COMMITTED, "s-1", "inv-1"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }
}
