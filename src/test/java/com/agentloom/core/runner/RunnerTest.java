package com.agentloom.core.runner;

import com.agentloom.core.agents.LlmAgent;
import com.agentloom.core.agents.RunConfig;
import com.agentloom.core.agents.SequentialAgent;
import com.agentloom.core.agents.StreamingMode;
import com.agentloom.core.artifacts.InMemoryArtifactService;
import com.agentloom.core.events.EventBus;
import com.agentloom.core.events.RunnerEvent;
import com.agentloom.core.llm.LlmResponse;
import com.agentloom.core.memory.InMemoryMemoryService;
import com.agentloom.core.metrics.RuntimeMetrics;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.model.Part;
import com.agentloom.core.session.InMemorySessionService;
import com.agentloom.core.session.Session;
import com.agentloom.core.stream.EventStream;
import com.agentloom.core.testing.ScriptedLlm;
import com.agentloom.core.testing.StepAgent;
import com.agentloom.core.tools.FunctionTool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

import static com.agentloom.core.testing.StepAgent.*;
import static org.junit.jupiter.api.Assertions.*;

class RunnerTest {

    private static final String APP = "runner_app";
    private static final Content HELLO = Content.userText("hello");

    private InMemorySessionService sessions;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ExecutorService executor;
    private List<RunnerEvent> published;

    @BeforeEach
    void setUp() {
        sessions = new InMemorySessionService();
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        executor = RunnerExecutors.newCachedDaemonPool("runner-test");
        published = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(published::add);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    private Runner runner(com.agentloom.core.agents.BaseAgent root) {
        return new Runner(APP, root, sessions, new InMemoryArtifactService(), new InMemoryMemoryService(),
                eventBus, new RuntimeMetrics(registry), executor);
    }

    private Session stored(String sessionId) {
        return sessions.getSession(APP, "u1", sessionId).orElseThrow();
    }

    private List<String> publishedTypes() {
        return published.stream().map(RunnerEvent::eventType).toList();
    }

    // ── Sessions ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("session handling")
    class SessionHandling {

        @Test
        @DisplayName("creates the session on first use and commits the user message first")
        void createsSessionAndCommitsUserMessage() {
            var runner = runner(new StepAgent("echo", say("hi")));

            List<Event> events = runner.runToList("u1", "new-session", HELLO);

            Session session = stored("new-session");
            assertEquals(2, session.eventCount());
            Event user = session.events().get(0);
            assertEquals("user", user.author());
            assertEquals("hello", user.text());
            assertTrue(user.invocationId().startsWith("e-"));
            assertEquals(user.invocationId(), events.get(0).invocationId());
        }

        @Test
        @DisplayName("reuses an existing session and its state")
        void reusesSession() {
            sessions.createSession(APP, "u1", Map.of("n", 10), "s1");
            var counter = new StepAgent("counter", increment("n"));
            var runner = runner(counter);

            runner.runToList("u1", "s1", HELLO);
            runner.runToList("u1", "s1", HELLO);

            assertEquals(12, stored("s1").state().get("n"));
            assertEquals(4, stored("s1").eventCount());
        }

        @Test
        @DisplayName("each invocation gets its own id")
        void distinctInvocationIds() {
            var runner = runner(new StepAgent("echo", say("hi")));

            String first = runner.runToList("u1", "s1", HELLO).get(0).invocationId();
            String second = runner.runToList("u1", "s1", HELLO).get(0).invocationId();

            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("runs without a new message")
        void withoutMessage() {
            var runner = runner(new StepAgent("echo", say("hi")));

            List<Event> events = runner.runToList("u1", "s1", null);

            assertEquals(1, events.size());
            assertEquals(1, stored("s1").eventCount());
        }

        @Test
        @DisplayName("temp: state is visible within the invocation but never stored")
        void tempScratchScenario() {
            var model = new ScriptedLlm(request -> {
                List<Content> contents = request.contents();
                boolean toolDone = !contents.get(contents.size() - 1).functionResponses().isEmpty();
                return List.of(toolDone
                        ? LlmResponse.text("noted")
                        : LlmResponse.of(new Content(Content.ROLE_MODEL,
                                List.of(Part.fromFunctionCall("c1", "scribble", Map.of())))));
            });
            var scribble = FunctionTool.of("scribble", "Writes scratch data", (args, ctx) -> {
                ctx.state().put("temp:scratch", "draft notes");
                return Map.of("ok", true);
            });
            var writer = LlmAgent.builder().name("writer").model(model).tools(scribble).build();
            var readerModel = ScriptedLlm.replyingText("read");
            var reader = LlmAgent.builder().name("reader").model(readerModel)
                    .instruction("Scratch says: {temp:scratch}").build();
            var runner = runner(new SequentialAgent("pipeline", List.of(writer, reader)));

            runner.runToList("u1", "s1", HELLO);

            assertEquals("Scratch says: draft notes", readerModel.requests().get(0).systemInstruction());
            Session reloaded = stored("s1");
            assertFalse(reloaded.state().containsKey("temp:scratch"));
            assertTrue(reloaded.events().stream()
                    .noneMatch(e -> e.actions().stateDelta().containsKey("temp:scratch")));

            // a new invocation no longer sees the scratch value
            var laterModel = ScriptedLlm.replyingText("later");
            var later = LlmAgent.builder().name("later").model(laterModel)
                    .instruction("Scratch: {temp:scratch?}").build();
            runner(later).runToList("u1", "s1", HELLO);
            assertEquals("Scratch: ", laterModel.requests().get(0).systemInstruction());
        }
    }

    // ── Commit protocol ──────────────────────────────────────────────────

    @Nested
    @DisplayName("commit protocol")
    class CommitProtocol {

        @Test
        @DisplayName("an event is committed before the caller receives it")
        void committedBeforeDelivery() {
            var runner = runner(new StepAgent("writer", put("a", 1), put("b", 2)));

            try (EventStream stream = runner.run("u1", "s1", HELLO)) {
                stream.next();
                assertEquals(1, stored("s1").state().get("a"));
                assertFalse(stored("s1").state().containsKey("b"));
                stream.next();
                assertEquals(2, stored("s1").state().get("b"));
            }
        }

        @Test
        @DisplayName("partial events reach the caller but are not committed")
        void partialsNotCommitted() {
            var model = new ScriptedLlm(request -> List.of(
                    LlmResponse.partialText("a"), LlmResponse.partialText("b"), LlmResponse.text("ab")));
            var runner = runner(LlmAgent.builder().name("streamer").model(model).build());

            List<Event> events = runner.runToList("u1", "s1", HELLO,
                    new RunConfig(StreamingMode.SSE, RunConfig.DEFAULT_MAX_LLM_CALLS));

            assertEquals(3, events.size());
            assertEquals(2, stored("s1").eventCount());
            assertEquals(2.0, registry.find("agentloom.events.partial").tag("author", "streamer").counter().count());
            assertEquals(1.0, registry.find("agentloom.events.committed").tag("author", "streamer").counter().count());
        }

        @Test
        @DisplayName("closing early ends the invocation without committing more")
        void closeEarly() {
            var agent = new StepAgent("writer", put("a", 1), put("b", 2), put("c", 3));
            var runner = runner(agent);

            EventStream stream = runner.run("u1", "s1", HELLO);
            stream.next();
            stream.close();

            assertFalse(stream.hasNext());
            assertFalse(stored("s1").state().containsKey("b"));
            assertEquals(List.of(RunnerEvent.INVOCATION_STARTED, RunnerEvent.EVENT_COMMITTED,
                    RunnerEvent.INVOCATION_ENDED), publishedTypes());
        }
    }

    // ── Notifications ────────────────────────────────────────────────────

    @Nested
    @DisplayName("notifications and metrics")
    class Notifications {

        @Test
        @DisplayName("publishes the lifecycle of a completed invocation")
        void completedLifecycle() {
            var runner = runner(new StepAgent("writer", put("a", 1), say("done")));

            runner.runToList("u1", "s1", HELLO);

            assertEquals(List.of(RunnerEvent.INVOCATION_STARTED, RunnerEvent.EVENT_COMMITTED,
                    RunnerEvent.EVENT_COMMITTED, RunnerEvent.INVOCATION_COMPLETED), publishedTypes());
            RunnerEvent committed = published.get(1);
            assertEquals("s1", committed.sessionId());
            assertEquals("writer", committed.author());
            assertEquals(List.of("a"), committed.payload().get("stateKeys"));
            assertEquals(2, published.get(3).payload().get("committedEvents"));
            assertEquals(1.0, registry.find("agentloom.invocations.total")
                    .tag("app", APP).tag("outcome", "completed").counter().count());
            assertEquals(1, registry.find("agentloom.invocation.duration").timer().count());
        }

        @Test
        @DisplayName("an invocation listener follows one run and detaches when it completes")
        void invocationListener() {
            List<RunnerEvent> followed = new CopyOnWriteArrayList<>();
            eventBus.subscribe(e -> RunnerEvent.INVOCATION_STARTED.equals(e.eventType()),
                    started -> eventBus.subscribeToInvocation(started.invocationId(), followed::add));
            int before = eventBus.listenerCount();
            var runner = runner(new StepAgent("writer", say("one"), say("two")));

            runner.runToList("u1", "s1", HELLO);
            runner.runToList("u1", "s1", HELLO);

            assertEquals(before, eventBus.listenerCount());
            assertEquals(List.of(RunnerEvent.EVENT_COMMITTED, RunnerEvent.EVENT_COMMITTED,
                    RunnerEvent.INVOCATION_COMPLETED, RunnerEvent.EVENT_COMMITTED, RunnerEvent.EVENT_COMMITTED,
                    RunnerEvent.INVOCATION_COMPLETED), followed.stream().map(RunnerEvent::eventType).toList());
            assertEquals(2, followed.stream().map(RunnerEvent::invocationId).distinct().count());
        }

        @Test
        @DisplayName("publishes a failure and rethrows it")
        void failedLifecycle() {
            var runner = runner(new StepAgent("breaker", say("one"), failing("exploded")));

            var ex = assertThrows(IllegalStateException.class, () -> runner.runToList("u1", "s1", HELLO));

            assertEquals("exploded", ex.getMessage());
            assertEquals(RunnerEvent.INVOCATION_FAILED, published.get(published.size() - 1).eventType());
            assertEquals("exploded", published.get(published.size() - 1).payload().get("error"));
            assertEquals(1.0, registry.find("agentloom.invocations.total")
                    .tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("an ended invocation is reported as ended")
        void endedLifecycle() {
            var stopper = new StepAgent("stopper", (ctx, event) -> {
                ctx.setEndInvocation();
                return event.content(Content.modelText("bye")).build();
            }, say("never"));
            var runner = runner(stopper);

            List<Event> events = runner.runToList("u1", "s1", HELLO);

            assertEquals(1, events.size());
            assertEquals(RunnerEvent.INVOCATION_ENDED, published.get(published.size() - 1).eventType());
            assertEquals(1.0, registry.find("agentloom.invocations.total")
                    .tag("outcome", "ended").counter().count());
        }

        @Test
        @DisplayName("a runner without bus and metrics still works")
        void withoutObservers() {
            var runner = new Runner(APP, new StepAgent("echo", say("hi")), sessions, null, null, null, null, executor);

            assertEquals(1, runner.runToList("u1", "s1", HELLO).size());
        }

        @Test
        @DisplayName("clears the invocation MDC when done")
        void clearsMdc() {
            var runner = runner(new StepAgent("echo", say("hi")));

            runner.runToList("u1", "s1", HELLO);

            assertNull(MDC.get("invocationId"));
            assertNull(MDC.get("sessionId"));
        }
    }

    @Test
    @DisplayName("InMemoryRunner wires its own services")
    void inMemoryRunner() {
        var runner = new InMemoryRunner(new StepAgent("echo", say("hi")), "demo");

        List<Event> events = runner.runToList("u1", "s1", HELLO);

        assertEquals("demo", runner.appName());
        assertEquals(1, events.size());
        assertNotNull(runner.artifactService());
        assertNotNull(runner.memoryService());
        assertTrue(runner.sessionService().getSession("demo", "u1", "s1").isPresent());
    }

    @Test
    @DisplayName("RunnerFactory builds runners sharing its services")
    void runnerFactory() {
        var factory = new RunnerFactory("factory_app", RunConfig.defaults(), sessions,
                new InMemoryArtifactService(), new InMemoryMemoryService(), eventBus,
                new RuntimeMetrics(registry), executor);

        Runner runner = factory.create(new StepAgent("echo", say("hi")));
        runner.runToList("u1", "s1", HELLO);

        assertEquals("factory_app", runner.appName());
        assertSame(sessions, runner.sessionService());
        assertTrue(sessions.getSession("factory_app", "u1", "s1").isPresent());
        assertEquals("other", factory.create("other", new StepAgent("echo2", say("hi"))).appName());
    }
}
