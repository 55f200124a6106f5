package com.agentloom.core.config;

import com.agentloom.core.artifacts.ArtifactService;
import com.agentloom.core.artifacts.InMemoryArtifactService;
import com.agentloom.core.events.EventBus;
import com.agentloom.core.memory.InMemoryMemoryService;
import com.agentloom.core.memory.MemoryService;
import com.agentloom.core.metrics.RuntimeMetrics;
import com.agentloom.core.runner.RunnerExecutors;
import com.agentloom.core.runner.RunnerFactory;
import com.agentloom.core.session.SessionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.concurrent.ExecutorService;

/**
 * Wires the runtime: stores, event bus, metrics, the agent executor and a
 * {@link RunnerFactory}. Every bean backs off when the application defines its own.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(AgentloomProperties.class)
@Import(SessionStoreConfig.class)
public class AgentloomAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentloomAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EventBus agentloomEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuntimeMetrics agentloomRuntimeMetrics(ObjectProvider<MeterRegistry> registry) {
        return new RuntimeMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactService agentloomArtifactService() {
        return new InMemoryArtifactService();
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryService agentloomMemoryService() {
        return new InMemoryMemoryService();
    }

    @Bean(name = "agentloomExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "agentloomExecutor")
    public ExecutorService agentloomExecutor(AgentloomProperties properties) {
        return RunnerExecutors.newCachedDaemonPool(properties.getExecutor().getThreadNamePrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public RunnerFactory agentloomRunnerFactory(AgentloomProperties properties, SessionService sessionService,
                                                ArtifactService artifactService, MemoryService memoryService,
                                                EventBus eventBus, RuntimeMetrics metrics,
                                                ExecutorService agentloomExecutor) {
        properties.validate();
        log.info("Agentloom runtime ready: app '{}', session store {}, max LLM calls {}",
                properties.getRunner().getAppName(), sessionService.getClass().getSimpleName(),
                properties.getRunner().getMaxLlmCalls());
        return new RunnerFactory(properties.getRunner().getAppName(), properties.toRunConfig(),
                sessionService, artifactService, memoryService, eventBus, metrics, agentloomExecutor);
    }
}
