package com.agentloom.core.agents;

import com.agentloom.core.artifacts.ArtifactService;
import com.agentloom.core.memory.MemoryService;
import com.agentloom.core.model.Content;
import com.agentloom.core.session.Session;
import com.agentloom.core.session.SessionService;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything an agent needs while it runs inside one invocation.
 * <p>
 * Contexts are immutable; {@link #withAgent} and {@link #withBranch} derive copies for a
 * child. The end-invocation flag and the model-call counter are shared by every context
 * derived from the same root, so setting the flag anywhere stops the whole invocation.
 */
public final class InvocationContext {

    private final String invocationId;
    private final Session session;
    private final BaseAgent agent;
    private final Content userContent;
    private final String branch;
    private final SessionService sessionService;
    private final ArtifactService artifactService;
    private final MemoryService memoryService;
    private final RunConfig runConfig;
    private final Executor executor;
    private final AtomicBoolean endInvocation;
    private final AtomicInteger llmCallCount;

    private InvocationContext(Builder b, AtomicBoolean endInvocation, AtomicInteger llmCallCount) {
        this.invocationId = Objects.requireNonNull(b.invocationId, "invocationId must not be null");
        this.session = Objects.requireNonNull(b.session, "session must not be null");
        this.agent = b.agent;
        this.userContent = b.userContent;
        this.branch = b.branch;
        this.sessionService = b.sessionService;
        this.artifactService = b.artifactService;
        this.memoryService = b.memoryService;
        this.runConfig = b.runConfig != null ? b.runConfig : RunConfig.defaults();
        this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
        this.endInvocation = endInvocation;
        this.llmCallCount = llmCallCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Context for running {@code child}; branch and shared flags are kept. */
    public InvocationContext withAgent(BaseAgent child) {
        return derive(child, branch);
    }

    /** Context with a different branch, used for isolated parallel children. */
    public InvocationContext withBranch(String newBranch) {
        return derive(agent, newBranch);
    }

    private InvocationContext derive(BaseAgent newAgent, String newBranch) {
        var b = new Builder()
                .invocationId(invocationId)
                .session(session)
                .agent(newAgent)
                .userContent(userContent)
                .branch(newBranch)
                .sessionService(sessionService)
                .artifactService(artifactService)
                .memoryService(memoryService)
                .runConfig(runConfig)
                .executor(executor);
        return new InvocationContext(b, endInvocation, llmCallCount);
    }

    public String invocationId() {
        return invocationId;
    }

    public Session session() {
        return session;
    }

    public BaseAgent agent() {
        return agent;
    }

    public Content userContent() {
        return userContent;
    }

    public String branch() {
        return branch;
    }

    public SessionService sessionService() {
        return sessionService;
    }

    public ArtifactService artifactService() {
        return artifactService;
    }

    public MemoryService memoryService() {
        return memoryService;
    }

    public RunConfig runConfig() {
        return runConfig;
    }

    public Executor executor() {
        return executor;
    }

    public boolean isEndInvocation() {
        return endInvocation.get();
    }

    public void setEndInvocation() {
        endInvocation.set(true);
    }

    public int llmCallCount() {
        return llmCallCount.get();
    }

    /**
     * Counts one model call against the invocation limit.
     *
     * @throws LlmCallsLimitExceededException when the call would exceed {@link RunConfig#maxLlmCalls()}
     */
    public void incrementLlmCallCount() {
        int count = llmCallCount.incrementAndGet();
        int limit = runConfig.maxLlmCalls();
        if (limit > 0 && count > limit) {
            throw new LlmCallsLimitExceededException(limit);
        }
    }

    public static final class Builder {

        private String invocationId;
        private Session session;
        private BaseAgent agent;
        private Content userContent;
        private String branch;
        private SessionService sessionService;
        private ArtifactService artifactService;
        private MemoryService memoryService;
        private RunConfig runConfig;
        private Executor executor;

        private Builder() {}

        public Builder invocationId(String invocationId) {
            this.invocationId = invocationId;
            return this;
        }

        public Builder session(Session session) {
            this.session = session;
            return this;
        }

        public Builder agent(BaseAgent agent) {
            this.agent = agent;
            return this;
        }

        public Builder userContent(Content userContent) {
            this.userContent = userContent;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder sessionService(SessionService sessionService) {
            this.sessionService = sessionService;
            return this;
        }

        public Builder artifactService(ArtifactService artifactService) {
            this.artifactService = artifactService;
            return this;
        }

        public Builder memoryService(MemoryService memoryService) {
            this.memoryService = memoryService;
            return this;
        }

        public Builder runConfig(RunConfig runConfig) {
            this.runConfig = runConfig;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public InvocationContext build() {
            return new InvocationContext(this, new AtomicBoolean(), new AtomicInteger());
        }
    }
}
