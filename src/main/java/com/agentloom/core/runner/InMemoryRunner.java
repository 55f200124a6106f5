package com.agentloom.core.runner;

import com.agentloom.core.agents.BaseAgent;
import com.agentloom.core.artifacts.InMemoryArtifactService;
import com.agentloom.core.memory.InMemoryMemoryService;
import com.agentloom.core.session.InMemorySessionService;

/**
 * {@link Runner} wired with in-memory session, artifact and memory services and its own
 * daemon thread pool. Suitable for tests and local experiments.
 */
public class InMemoryRunner extends Runner {

    public InMemoryRunner(BaseAgent rootAgent) {
        this(rootAgent, "InMemoryRunnerApp");
    }

    public InMemoryRunner(BaseAgent rootAgent, String appName) {
        super(appName, rootAgent, new InMemorySessionService(), new InMemoryArtifactService(),
                new InMemoryMemoryService(), null, null, RunnerExecutors.newCachedDaemonPool("agentloom-" + appName));
    }
}
