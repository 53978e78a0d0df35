package com.agentdebate.orchestrator.api.dto;

import com.agentdebate.orchestrator.model.DebateRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One line of GET /debates: enough to pick a debate without pulling three
 * full responses.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DebateSummaryResponse(
        String  debateId,
        String  title,
        Instant createdAt,
        long    totalExecutionTimeMs,
        int     agentCount,
        int     failedAgents
) {
    public static DebateSummaryResponse from(DebateRecord debate) {
        int failed = (int) debate.agentResponses().stream().filter(r -> !r.success()).count();
        return new DebateSummaryResponse(
                debate.debateId(),
                debate.topic().title(),
                debate.createdAt(),
                debate.totalExecutionTimeMs(),
                debate.agentResponses().size(),
                failed
        );
    }
}
