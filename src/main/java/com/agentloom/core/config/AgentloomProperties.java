package com.agentloom.core.config;

import com.agentloom.core.agents.RunConfig;
import com.agentloom.core.agents.StreamingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agentloom")
public class AgentloomProperties {

    private Runner runner = new Runner();
    private Session session = new Session();
    private Executor executor = new Executor();

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    /**
     * Run configuration handed to invocations that do not bring their own.
     */
    public RunConfig toRunConfig() {
        return new RunConfig(runner.getStreamingMode(), runner.getMaxLlmCalls());
    }

    /**
     * Fails fast on settings that would only surface as errors mid-invocation.
     */
    public void validate() {
        if (runner.getAppName() == null || runner.getAppName().isBlank()) {
            throw new IllegalStateException("agentloom.runner.app-name must not be blank");
        }
        if (runner.getMaxLlmCalls() < 0) {
            throw new IllegalStateException("agentloom.runner.max-llm-calls must be >= 0, got " + runner.getMaxLlmCalls());
        }
        if (executor.getThreadNamePrefix() == null || executor.getThreadNamePrefix().isBlank()) {
            throw new IllegalStateException("agentloom.executor.thread-name-prefix must not be blank");
        }
    }

    public static class Runner {

        private String appName = "agentloom";
        private int maxLlmCalls = RunConfig.DEFAULT_MAX_LLM_CALLS;
        private StreamingMode streamingMode = StreamingMode.NONE;

        public String getAppName() {
            return appName;
        }

        public void setAppName(String appName) {
            this.appName = appName;
        }

        public int getMaxLlmCalls() {
            return maxLlmCalls;
        }

        public void setMaxLlmCalls(int maxLlmCalls) {
            this.maxLlmCalls = maxLlmCalls;
        }

        public StreamingMode getStreamingMode() {
            return streamingMode;
        }

        public void setStreamingMode(StreamingMode streamingMode) {
            this.streamingMode = streamingMode;
        }
    }

    public static class Session {

        /** {@code auto} picks JDBC when a DataSource exists, {@code memory} or {@code jdbc} force one. */
        private String store = "auto";
        private boolean createTables = true;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public boolean isCreateTables() {
            return createTables;
        }

        public void setCreateTables(boolean createTables) {
            this.createTables = createTables;
        }
    }

    public static class Executor {

        private String threadNamePrefix = "agentloom";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
