package com.crewloop.config;

import com.crewloop.core.persistence.EventLogPersister;
import com.crewloop.core.persistence.FileEventLogPersister;
import com.crewloop.core.persistence.FileIterationStateStore;
import com.crewloop.core.persistence.InMemoryIterationStateStore;
import com.crewloop.core.persistence.IterationStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses where iteration checkpoints and event logs live.
 * {@code crewloop.persistence.provider=file} (default) keeps them under {@code .crewloop/} in the
 * workspace; {@code memory} keeps checkpoints in the process only.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    @ConditionalOnProperty(name = "crewloop.persistence.provider", havingValue = "file", matchIfMissing = true)
    public IterationStateStore fileIterationStateStore(CrewloopProperties properties, ObjectMapper objectMapper) {
        return new FileIterationStateStore(properties.getWorkspacePath(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(IterationStateStore.class)
    public IterationStateStore inMemoryIterationStateStore() {
        return new InMemoryIterationStateStore();
    }

    @Bean
    @ConditionalOnProperty(name = "crewloop.persistence.event-log", havingValue = "true", matchIfMissing = true)
    public EventLogPersister eventLogPersister(CrewloopProperties properties, ObjectMapper objectMapper) {
        return new FileEventLogPersister(properties.getWorkspacePath(), objectMapper);
    }
}
