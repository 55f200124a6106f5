package com.agentloom.core.runner;

import com.agentloom.core.agents.BaseAgent;
import com.agentloom.core.agents.RunConfig;
import com.agentloom.core.artifacts.ArtifactService;
import com.agentloom.core.events.EventBus;
import com.agentloom.core.memory.MemoryService;
import com.agentloom.core.metrics.RuntimeMetrics;
import com.agentloom.core.session.SessionService;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builds {@link Runner}s that share the application's services, event bus, metrics and
 * executor. Registered as a bean by the auto-configuration.
 */
public class RunnerFactory {

    private final String defaultAppName;
    private final RunConfig defaultRunConfig;
    private final SessionService sessionService;
    private final ArtifactService artifactService;
    private final MemoryService memoryService;
    private final EventBus eventBus;
    private final RuntimeMetrics metrics;
    private final Executor executor;

    public RunnerFactory(String defaultAppName, RunConfig defaultRunConfig, SessionService sessionService,
                         ArtifactService artifactService, MemoryService memoryService,
                         EventBus eventBus, RuntimeMetrics metrics, Executor executor) {
        this.defaultAppName = Objects.requireNonNull(defaultAppName, "defaultAppName must not be null");
        this.defaultRunConfig = Objects.requireNonNull(defaultRunConfig, "defaultRunConfig must not be null");
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.artifactService = artifactService;
        this.memoryService = memoryService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public Runner create(BaseAgent rootAgent) {
        return create(defaultAppName, rootAgent);
    }

    public Runner create(String appName, BaseAgent rootAgent) {
        return new Runner(appName, rootAgent, sessionService, artifactService, memoryService,
                eventBus, metrics, executor);
    }

    /** Run configuration built from {@code agentloom.runner.*}. */
    public RunConfig defaultRunConfig() {
        return defaultRunConfig;
    }

    public SessionService sessionService() {
        return sessionService;
    }
}
