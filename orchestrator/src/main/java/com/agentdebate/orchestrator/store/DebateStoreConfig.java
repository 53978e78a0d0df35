package com.agentdebate.orchestrator.store;

import com.agentdebate.orchestrator.repository.DebateIndexRepository;
import com.agentdebate.orchestrator.repository.StoredDebateRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Picks the debate store from {@code debate.store.type}:
 * <ul>
 *   <li>{@code file} (default): JSON documents under {@code debate.store.directory}</li>
 *   <li>{@code database}: the debates / debate_index tables</li>
 * </ul>
 */
@Configuration
public class DebateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(DebateStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "debate.store.type", havingValue = "file", matchIfMissing = true)
    public DebateStore fileDebateStore(@Value("${debate.store.directory:./data/debates}") String directory,
                                       ObjectMapper objectMapper) {
        Path root = Path.of(directory).toAbsolutePath().normalize();
        log.info("Using file debate store at {}", root);
        return new FileDebateStore(root, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "debate.store.type", havingValue = "database")
    public DebateStore jpaDebateStore(StoredDebateRepository debateRepo,
                                      DebateIndexRepository indexRepo,
                                      ObjectMapper objectMapper) {
        log.info("Using database debate store");
        return new JpaDebateStore(debateRepo, indexRepo, objectMapper);
    }
}
