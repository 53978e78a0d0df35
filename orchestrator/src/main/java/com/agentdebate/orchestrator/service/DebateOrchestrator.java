package com.agentdebate.orchestrator.service;

import com.agentdebate.orchestrator.agent.AgentRunner;
import com.agentdebate.orchestrator.agent.CliAgentRegistry;
import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.agentdebate.orchestrator.error.DebatePersistenceException;
import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.AgentResponse;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.model.DebateRole;
import com.agentdebate.orchestrator.model.DebateTopic;
import com.agentdebate.orchestrator.prompt.DebatePrompts;
import com.agentdebate.orchestrator.store.DebateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs a debate: FOR → AGAINST → SYNTHESIS, each stage seeing the earlier
 * stages' full response text.
 *
 * The stages are strictly sequential because each prompt depends on the
 * previous answers. A failed stage does not stop the debate: its (usually
 * empty) text is passed on as-is and the failure is visible on that stage's
 * AgentResponse. Only a bad agent set or a storage failure fails the call.
 */
@Service
public class DebateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DebateOrchestrator.class);

    private static final Set<DebateRole> REQUIRED_ROLES = EnumSet.allOf(DebateRole.class);

    private final AgentRunner      agentRunner;
    private final CliAgentRegistry cliAgents;
    private final DebateStore      store;
    private final MeterRegistry    meterRegistry;

    public DebateOrchestrator(AgentRunner agentRunner,
                              CliAgentRegistry cliAgents,
                              DebateStore store,
                              MeterRegistry meterRegistry) {
        this.agentRunner   = agentRunner;
        this.cliAgents     = cliAgents;
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Running a debate
    // ------------------------------------------------------------------

    /**
     * Run a complete debate and persist it.
     *
     * @param agentsConfig exactly one config per role, in any order; the
     *                     record keeps this order in agents_config
     * @throws DebateConfigurationException before any agent runs, if the
     *                                      agent set is invalid
     * @throws DebatePersistenceException   if the debate ran but could not be
     *                                      saved (carries the record)
     */
    public DebateRecord runDebate(DebateTopic topic, List<AgentConfig> agentsConfig) {
        Map<DebateRole, AgentConfig> byRole = validate(topic, agentsConfig);

        String debateId = UUID.randomUUID().toString();
        MDC.put("debateId", debateId);
        try {
            log.info("Starting debate {} on '{}' with agents {}", debateId, topic.title(),
                    agentsConfig.stream().map(AgentConfig::name).toList());

            long start = System.nanoTime();

            AgentResponse forResponse = runStage(byRole.get(DebateRole.FOR),
                    DebatePrompts.forPrompt(topic));

            AgentResponse againstResponse = runStage(byRole.get(DebateRole.AGAINST),
                    DebatePrompts.againstPrompt(topic, forResponse.responseText()));

            AgentResponse synthesisResponse = runStage(byRole.get(DebateRole.SYNTHESIS),
                    DebatePrompts.synthesisPrompt(topic,
                            forResponse.responseText(),
                            againstResponse.responseText()));

            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            DebateRecord debate = new DebateRecord(
                    debateId,
                    topic,
                    agentsConfig,
                    List.of(forResponse, againstResponse, synthesisResponse),
                    totalMs,
                    Instant.now());

            long failed = debate.agentResponses().stream().filter(r -> !r.success()).count();
            log.info("Debate {} finished in {} ms ({} of 3 stages failed)", debateId, totalMs, failed);

            persist(debate);
            return debate;
        } finally {
            MDC.remove("debateId");
        }
    }

    // ------------------------------------------------------------------
    // Reading stored debates
    // ------------------------------------------------------------------

    /** @throws com.agentdebate.orchestrator.error.DebateNotFoundException if unknown */
    public DebateRecord getDebate(String debateId) {
        return store.get(debateId);
    }

    /** Most recent first, at most {@code limit}. */
    public List<DebateRecord> listDebates(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        return store.list(limit);
    }

    public boolean deleteDebate(String debateId) {
        return store.delete(debateId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Check the agent set and index it by role. Nothing is launched if this
     * throws.
     */
    private Map<DebateRole, AgentConfig> validate(DebateTopic topic, List<AgentConfig> agentsConfig) {
        if (topic == null) {
            throw new DebateConfigurationException("Debate topic is required");
        }
        if (agentsConfig == null || agentsConfig.size() != DebateRecord.AGENT_COUNT) {
            throw new DebateConfigurationException("Debate requires exactly " + DebateRecord.AGENT_COUNT
                    + " agents, got " + (agentsConfig == null ? 0 : agentsConfig.size()));
        }
        if (agentsConfig.stream().anyMatch(Objects::isNull)) {
            throw new DebateConfigurationException("Agent configs must not contain null entries");
        }

        List<DebateRole> roles = agentsConfig.stream().map(AgentConfig::role).toList();
        Set<DebateRole> distinct = roles.stream()
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DebateRole.class)));
        if (!distinct.equals(REQUIRED_ROLES)) {
            throw new DebateConfigurationException(
                    "Agents must have roles FOR, AGAINST, SYNTHESIS. Got: " + roles);
        }
        if (distinct.size() != roles.size()) {
            throw new DebateConfigurationException("Duplicate agent roles found: " + roles);
        }

        for (AgentConfig config : agentsConfig) {
            if (!cliAgents.supports(config.modelProvider())) {
                throw new DebateConfigurationException("Unknown provider for agent '" + config.name()
                        + "': " + config.modelProvider().id());
            }
        }

        // EnumMap iterates in declaration order, which is the execution order.
        Map<DebateRole, AgentConfig> byRole = new EnumMap<>(DebateRole.class);
        agentsConfig.forEach(c -> byRole.put(c.role(), c));
        return byRole;
    }

    private AgentResponse runStage(AgentConfig config, String prompt) {
        log.info("Stage {}: agent '{}'", config.role(), config.name());
        AgentResponse response = agentRunner.execute(config, prompt);
        if (!response.success()) {
            log.warn("Stage {} failed, continuing with its partial text: {}",
                    config.role(), response.errorMessage());
        }
        return response;
    }

    /**
     * Hand the record to the store. A store failure is rethrown with the
     * record attached so the caller still has the debate.
     */
    private void persist(DebateRecord debate) {
        try {
            store.save(debate);
            meterRegistry.counter("debate.runs", "status", "completed").increment();
        } catch (RuntimeException e) {
            meterRegistry.counter("debate.runs", "status", "persist_failed").increment();
            log.error("Debate {} could not be saved", debate.debateId(), e);
            throw new DebatePersistenceException(debate, e);
        }
    }
}
