package com.agentdebate.orchestrator.api.dto;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.DebateTopic;
import com.agentdebate.orchestrator.service.DebatePresets;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Request body for POST /debates.
 *
 * Either give an explicit {@code agents} list, or a {@code provider} preset
 * (claude, gemini, mixed). With neither, the claude preset is used.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunDebateRequest(String title,
                               String description,
                               String provider,
                               List<AgentConfigRequest> agents) {

    public DebateTopic topic() {
        return new DebateTopic(title, description);
    }

    public List<AgentConfig> agentConfigs() {
        if (agents == null || agents.isEmpty()) {
            return DebatePresets.agentsFor(provider);
        }
        return agents.stream().map(AgentConfigRequest::toConfig).toList();
    }
}
