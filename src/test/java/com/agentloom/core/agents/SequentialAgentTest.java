package com.agentloom.core.agents;

import com.agentloom.core.llm.LlmResponse;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.runner.InMemoryRunner;
import com.agentloom.core.session.Session;
import com.agentloom.core.testing.ScriptedLlm;
import com.agentloom.core.testing.StepAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentloom.core.testing.StepAgent.*;
import static org.junit.jupiter.api.Assertions.*;

class SequentialAgentTest {

    private static final Content HELLO = Content.userText("hello");

    @Test
    @DisplayName("runs children in order and commits every event")
    void runsInOrder() {
        var a = new StepAgent("a", say("a1"), say("a2"));
        var b = new StepAgent("b", say("b1"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(a, b)));

        List<Event> events = runner.runToList("u1", "s1", HELLO);

        assertEquals(List.of("a1", "a2", "b1"), events.stream().map(Event::text).toList());
        assertEquals(List.of("a", "a", "b"), events.stream().map(Event::author).toList());
        Session stored = runner.sessionService().getSession(runner.appName(), "u1", "s1").orElseThrow();
        assertEquals(List.of("user", "a", "a", "b"), stored.events().stream().map(Event::author).toList());
    }

    @Test
    @DisplayName("an agent resumes only after its previous event was committed")
    void commitBeforeResume() {
        var writer = new StepAgent("writer", put("x", 1), put("y", 2));
        var reader = new StepAgent("reader", say("read"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(writer, reader)));

        runner.runToList("u1", "s1", HELLO);

        assertFalse(writer.observedStates().get(0).containsKey("x"));
        assertEquals(1, writer.observedStates().get(1).get("x"));
        assertEquals(1, reader.observedStates().get(0).get("x"));
        assertEquals(2, reader.observedStates().get(0).get("y"));
    }

    @Test
    @DisplayName("increments compose across children because each reads committed state")
    void incrementsCompose() {
        var first = new StepAgent("first", increment("n"), increment("n"));
        var second = new StepAgent("second", increment("n"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(first, second)));

        runner.runToList("u1", "s1", HELLO);

        Session stored = runner.sessionService().getSession(runner.appName(), "u1", "s1").orElseThrow();
        assertEquals(3, stored.state().get("n"));
    }

    @Test
    @DisplayName("children run without a branch")
    void noBranch() {
        var a = new StepAgent("a", say("a1"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(a)));

        List<Event> events = runner.runToList("u1", "s1", HELLO);

        assertNull(events.get(0).branch());
    }

    @Test
    @DisplayName("escalation does not stop a sequence")
    void escalateIgnored() {
        var a = new StepAgent("a", escalate());
        var b = new StepAgent("b", say("b1"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(a, b)));

        List<Event> events = runner.runToList("u1", "s1", HELLO);

        assertEquals(2, events.size());
        assertEquals(1, b.runs());
    }

    @Test
    @DisplayName("an empty sequence yields nothing")
    void emptySequence() {
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of()));
        assertTrue(runner.runToList("u1", "s1", HELLO).isEmpty());
    }

    @Test
    @DisplayName("a failing child stops the sequence and propagates")
    void failurePropagates() {
        var a = new StepAgent("a", say("a1"), failing("broken"));
        var b = new StepAgent("b", say("b1"));
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(a, b)));

        var ex = assertThrows(IllegalStateException.class, () -> runner.runToList("u1", "s1", HELLO));
        assertEquals("broken", ex.getMessage());
        assertEquals(0, b.runs());
        Session stored = runner.sessionService().getSession(runner.appName(), "u1", "s1").orElseThrow();
        assertEquals(List.of("user", "a"), stored.events().stream().map(Event::author).toList());
    }

    @Test
    @DisplayName("output_key of one model agent feeds the instruction of the next")
    void outputKeyFeedsNextInstruction() {
        var writerModel = ScriptedLlm.replyingText("A poem about tides");
        var reviewerModel = ScriptedLlm.replyingText("Lovely");
        var writer = LlmAgent.builder()
                .name("writer")
                .model(writerModel)
                .instruction("Write a poem.")
                .outputKey("draft")
                .build();
        var reviewer = LlmAgent.builder()
                .name("reviewer")
                .model(reviewerModel)
                .instruction("Review this draft: {draft}")
                .outputKey("review")
                .build();
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(writer, reviewer)));

        runner.runToList("u1", "s1", HELLO);

        assertEquals("Review this draft: A poem about tides", reviewerModel.requests().get(0).systemInstruction());
        Session stored = runner.sessionService().getSession(runner.appName(), "u1", "s1").orElseThrow();
        assertEquals("A poem about tides", stored.state().get("draft"));
        assertEquals("Lovely", stored.state().get("review"));
    }

    @Test
    @DisplayName("the next model agent sees the previous agent's answer as context")
    void historyRewrittenForNextAgent() {
        var first = LlmAgent.builder().name("first").model(ScriptedLlm.replyingText("42")).build();
        var secondModel = ScriptedLlm.replying(LlmResponse.text("ok"));
        var second = LlmAgent.builder().name("second").model(secondModel).build();
        var runner = new InMemoryRunner(new SequentialAgent("pipeline", List.of(first, second)));

        runner.runToList("u1", "s1", HELLO);

        List<Content> contents = secondModel.requests().get(0).contents();
        assertEquals(2, contents.size());
        assertEquals("hello", contents.get(0).text());
        assertEquals(Content.ROLE_USER, contents.get(1).role());
        assertTrue(contents.get(1).text().contains("[first] said: 42"));
    }
}
