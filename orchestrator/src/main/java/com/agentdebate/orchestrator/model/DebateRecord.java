package com.agentdebate.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Complete record of one debate run.
 *
 * agentsConfig keeps the order the caller supplied; agentResponses is always
 * in execution order (FOR, AGAINST, SYNTHESIS) and always has three entries,
 * failed stages included.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DebateRecord(
        String              debateId,
        DebateTopic         topic,
        List<AgentConfig>   agentsConfig,
        List<AgentResponse> agentResponses,
        long                totalExecutionTimeMs,
        Instant             createdAt
) {
    public static final int AGENT_COUNT = 3;

    public DebateRecord {
        Objects.requireNonNull(debateId, "debateId");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(createdAt, "createdAt");
        agentsConfig   = List.copyOf(agentsConfig);
        agentResponses = List.copyOf(agentResponses);
        if (agentResponses.size() != AGENT_COUNT) {
            throw new IllegalArgumentException(
                    "A debate record holds exactly " + AGENT_COUNT + " responses, got " + agentResponses.size());
        }
        if (totalExecutionTimeMs < 0) {
            throw new IllegalArgumentException("total_execution_time_ms must be >= 0");
        }
    }

    public AgentResponse responseFor(DebateRole role) {
        return agentResponses.stream()
                .filter(r -> r.role() == role)
                .findFirst()
                .orElseThrow();
    }
}
