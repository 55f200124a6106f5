package com.agentloom.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent invocations.
 */
public class RuntimeMetrics {

    private final MeterRegistry registry;

    public RuntimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "completed", "ended" or "failed"
     */
    public void recordInvocation(String appName, String outcome, long ms) {
        Counter.builder("agentloom.invocations.total")
                .tag("app", appName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("agentloom.invocation.duration")
                .tag("app", appName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCommittedEvent(String author) {
        Counter.builder("agentloom.events.committed")
                .description("Events committed to the session store")
                .tag("author", author)
                .register(registry)
                .increment();
    }

    public void recordPartialEvent(String author) {
        Counter.builder("agentloom.events.partial")
                .description("Streaming fragments forwarded without commit")
                .tag("author", author)
                .register(registry)
                .increment();
    }
}
