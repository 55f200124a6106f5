package com.agentloom.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeMetricsTest {

    private SimpleMeterRegistry registry;
    private RuntimeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RuntimeMetrics(registry);
    }

    @Test
    @DisplayName("recordInvocation counts by outcome and times by app")
    void recordInvocation() {
        metrics.recordInvocation("demo", "completed", 120);
        metrics.recordInvocation("demo", "completed", 80);
        metrics.recordInvocation("demo", "failed", 10);

        var completed = registry.find("agentloom.invocations.total")
                .tag("app", "demo").tag("outcome", "completed").counter();
        var failed = registry.find("agentloom.invocations.total")
                .tag("outcome", "failed").counter();
        var timer = registry.find("agentloom.invocation.duration").tag("app", "demo").timer();

        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, failed.count());
        assertNotNull(timer);
        assertEquals(3, timer.count());
    }

    @Test
    @DisplayName("recordCommittedEvent increments by author tag")
    void recordCommittedEvent() {
        metrics.recordCommittedEvent("user");
        metrics.recordCommittedEvent("writer");
        metrics.recordCommittedEvent("writer");

        var writer = registry.find("agentloom.events.committed").tag("author", "writer").counter();
        assertNotNull(writer);
        assertEquals(2.0, writer.count());
    }

    @Test
    @DisplayName("recordPartialEvent increments the partial counter")
    void recordPartialEvent() {
        metrics.recordPartialEvent("streamer");

        var counter = registry.find("agentloom.events.partial").tag("author", "streamer").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
