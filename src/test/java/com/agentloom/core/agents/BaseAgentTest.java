package com.agentloom.core.agents;

import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.runner.InMemoryRunner;
import com.agentloom.core.session.Session;
import com.agentloom.core.testing.StepAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.agentloom.core.testing.StepAgent.*;
import static org.junit.jupiter.api.Assertions.*;

class BaseAgentTest {

    private static final Content HELLO = Content.userText("hello");

    private static Session stored(InMemoryRunner runner) {
        return runner.sessionService().getSession(runner.appName(), "u1", "s1").orElseThrow();
    }

    // ── Tree ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("agent tree")
    class Tree {

        @Test
        @DisplayName("names must be identifiers and not 'user'")
        void nameValidation() {
            assertThrows(IllegalArgumentException.class, () -> new StepAgent("has space"));
            assertThrows(IllegalArgumentException.class, () -> new StepAgent("1st"));
            assertThrows(IllegalArgumentException.class, () -> new StepAgent("user"));
            assertDoesNotThrow(() -> new StepAgent("_helper2"));
        }

        @Test
        @DisplayName("sub-agent names must be unique")
        void uniqueChildren() {
            var a1 = new StepAgent("a");
            var a2 = new StepAgent("a");
            assertThrows(IllegalArgumentException.class, () -> new SequentialAgent("seq", List.of(a1, a2)));
            assertNull(a1.parentAgent());
        }

        @Test
        @DisplayName("an agent can have only one parent")
        void singleParent() {
            var child = new StepAgent("child");
            new SequentialAgent("first", List.of(child));
            assertThrows(IllegalArgumentException.class, () -> new SequentialAgent("second", List.of(child)));
        }

        @Test
        @DisplayName("agents are found by name anywhere in the tree")
        void lookup() {
            var leaf = new StepAgent("leaf");
            var mid = new SequentialAgent("mid", List.of(leaf));
            var root = new LoopAgent("root", List.of(mid), 1);

            assertSame(leaf, root.findAgent("leaf").orElseThrow());
            assertSame(root, root.findAgent("root").orElseThrow());
            assertSame(leaf, root.findSubAgent("leaf").orElseThrow());
            assertTrue(root.findSubAgent("root").isEmpty());
            assertSame(root, leaf.rootAgent());
            assertSame(mid, leaf.parentAgent());
        }
    }

    // ── Agent callbacks ──────────────────────────────────────────────────

    @Nested
    @DisplayName("agent callbacks")
    class AgentCallbacks {

        @Test
        @DisplayName("before-agent content skips the agent and its after-agent callbacks")
        void beforeAgentSkips() {
            var inner = new StepAgent("inner", say("inner ran"));
            var afterCalls = new AtomicInteger();
            var seq = new SequentialAgent("guarded", "", List.of(inner),
                    List.of(ctx -> Optional.of(Content.modelText("blocked"))),
                    List.of(ctx -> {
                        afterCalls.incrementAndGet();
                        return Optional.empty();
                    }));
            var runner = new InMemoryRunner(seq);

            List<Event> events = runner.runToList("u1", "s1", HELLO);

            assertEquals(1, events.size());
            assertEquals("guarded", events.get(0).author());
            assertEquals("blocked", events.get(0).text());
            assertEquals(0, inner.runs());
            assertEquals(0, afterCalls.get());
        }

        @Test
        @DisplayName("before-agent state writes are committed before the agent runs")
        void beforeAgentStateCommitted() {
            var inner = new StepAgent("inner", say("ran"));
            var seq = new SequentialAgent("prepared", "", List.of(inner),
                    List.of(ctx -> {
                        ctx.state().put("prepared", true);
                        return Optional.empty();
                    }),
                    List.of());
            var runner = new InMemoryRunner(seq);

            List<Event> events = runner.runToList("u1", "s1", HELLO);

            assertEquals(2, events.size());
            assertNull(events.get(0).content());
            assertEquals(true, events.get(0).actions().stateDelta().get("prepared"));
            assertEquals(true, inner.observedStates().get(0).get("prepared"));
        }

        @Test
        @DisplayName("after-agent content is appended once the agent finished")
        void afterAgentAppends() {
            var inner = new StepAgent("inner", say("work"));
            var seq = new SequentialAgent("wrapped", "", List.of(inner), List.of(),
                    List.of(ctx -> Optional.of(Content.modelText("summary"))));

            List<Event> events = new InMemoryRunner(seq).runToList("u1", "s1", HELLO);

            assertEquals(List.of("work", "summary"), events.stream().map(Event::text).toList());
            assertEquals("wrapped", events.get(1).author());
        }

        @Test
        @DisplayName("callbacks run in order and the first decision wins")
        void firstDecisionWins() {
            var calls = new AtomicInteger();
            var seq = new SequentialAgent("ordered", "", List.of(new StepAgent("inner", say("x"))),
                    List.of(
                            ctx -> {
                                calls.incrementAndGet();
                                return Optional.empty();
                            },
                            ctx -> Optional.of(Content.modelText("second")),
                            ctx -> {
                                calls.incrementAndGet();
                                return Optional.of(Content.modelText("third"));
                            }),
                    List.of());

            List<Event> events = new InMemoryRunner(seq).runToList("u1", "s1", HELLO);

            assertEquals("second", events.get(0).text());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("ending the invocation stops everything after the current event")
        void endInvocation() {
            var first = new StepAgent("first", say("one"));
            var stopper = new SequentialAgent("stopper", "", List.of(new StepAgent("skipped", say("never"))),
                    List.of(ctx -> {
                        ctx.endInvocation();
                        return Optional.of(Content.modelText("stopping"));
                    }),
                    List.of());
            var last = new StepAgent("last", say("never"));
            var runner = new InMemoryRunner(new SequentialAgent("root", List.of(first, stopper, last)));

            List<Event> events = runner.runToList("u1", "s1", HELLO);

            assertEquals(List.of("one", "stopping"), events.stream().map(Event::text).toList());
            assertEquals(0, last.runs());
            assertEquals(3, stored(runner).eventCount());
        }
    }
}
