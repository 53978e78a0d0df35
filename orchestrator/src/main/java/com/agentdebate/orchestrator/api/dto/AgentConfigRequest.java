package com.agentdebate.orchestrator.api.dto;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.DebateRole;
import com.agentdebate.orchestrator.model.ModelProvider;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Locale;

/**
 * One agent in a POST /debates body.
 *
 * Required: name, role, model_provider, model_name
 * Optional: model_id, temperature, max_tokens, timeout_seconds (defaults
 *   from {@link AgentConfig} when omitted)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentConfigRequest(
        String  name,
        String  role,
        String  modelProvider,
        String  modelName,
        String  modelId,
        Double  temperature,
        Integer maxTokens,
        Integer timeoutSeconds
) {
    public AgentConfig toConfig() {
        return new AgentConfig(
                name,
                parseRole(role),
                ModelProvider.fromId(modelProvider),
                modelName,
                modelId,
                temperature    != null ? temperature    : AgentConfig.DEFAULT_TEMPERATURE,
                maxTokens      != null ? maxTokens      : AgentConfig.DEFAULT_MAX_TOKENS,
                timeoutSeconds != null ? timeoutSeconds : AgentConfig.DEFAULT_TIMEOUT_SECONDS);
    }

    private static DebateRole parseRole(String role) {
        if (role == null || role.isBlank()) {
            return null;
        }
        try {
            return DebateRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DebateConfigurationException("Unknown role: " + role);
        }
    }
}
