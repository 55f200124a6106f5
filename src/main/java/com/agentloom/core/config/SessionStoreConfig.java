package com.agentloom.core.config;

import com.agentloom.core.session.InMemorySessionService;
import com.agentloom.core.session.JdbcSessionService;
import com.agentloom.core.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link SessionService} bean.
 * <p>
 * When a {@link DataSource} is available and {@code agentloom.session.store} is not
 * {@code memory}, sessions are persisted through {@link JdbcSessionService}. Otherwise an
 * {@link InMemorySessionService} is used, which loses all sessions on restart.
 */
@Configuration(proxyBeanMethods = false)
public class SessionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(SessionService.class)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnExpression("'${agentloom.session.store:auto}' != 'memory'")
    public SessionService jdbcSessionService(DataSource dataSource, AgentloomProperties properties) throws SQLException {
        log.info("Configuring JDBC session store");
        var service = new JdbcSessionService(dataSource);
        if (properties.getSession().isCreateTables()) {
            service.createTables();
        }
        return service;
    }

    @Bean
    @ConditionalOnMissingBean(SessionService.class)
    public SessionService memorySessionService(AgentloomProperties properties) {
        if ("jdbc".equalsIgnoreCase(properties.getSession().getStore())) {
            throw new IllegalStateException("agentloom.session.store=jdbc requires a DataSource");
        }
        log.info("Using in-memory session store (sessions will not persist across restarts)");
        return new InMemorySessionService();
    }
}
