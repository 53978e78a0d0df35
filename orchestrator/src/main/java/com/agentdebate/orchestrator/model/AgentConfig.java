package com.agentdebate.orchestrator.model;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Configuration for one debate agent. Exactly one per role per debate.
 *
 * modelId is derived from provider + modelName when left blank, so configs
 * read back from storage keep whatever id was resolved when they ran.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentConfig(
        String        name,
        DebateRole    role,
        ModelProvider modelProvider,
        String        modelName,
        String        modelId,
        double        temperature,
        int           maxTokens,
        int           timeoutSeconds
) {
    public static final double DEFAULT_TEMPERATURE     = 0.7;
    public static final int    DEFAULT_MAX_TOKENS      = 2000;
    public static final int    DEFAULT_TIMEOUT_SECONDS = 60;

    public AgentConfig {
        if (name == null || name.isBlank()) {
            throw new DebateConfigurationException("Agent name must not be blank");
        }
        if (role == null) {
            throw new DebateConfigurationException("Agent '" + name + "' has no role");
        }
        if (modelProvider == null) {
            throw new DebateConfigurationException("Agent '" + name + "' has no model provider");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new DebateConfigurationException("Agent '" + name + "' has no model name");
        }
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
            throw new DebateConfigurationException(
                    "Agent '" + name + "' temperature must be within [0.0, 1.0], got " + temperature);
        }
        if (maxTokens <= 0) {
            throw new DebateConfigurationException(
                    "Agent '" + name + "' max_tokens must be positive, got " + maxTokens);
        }
        if (timeoutSeconds <= 0) {
            throw new DebateConfigurationException(
                    "Agent '" + name + "' timeout_seconds must be positive, got " + timeoutSeconds);
        }
        if (modelId == null || modelId.isBlank()) {
            modelId = modelProvider.resolveModelId(modelName);
        }
    }

    /** Config with the default temperature, token budget and timeout. */
    public static AgentConfig of(String name, DebateRole role, ModelProvider provider, String modelName) {
        return new AgentConfig(name, role, provider, modelName, null,
                DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_TIMEOUT_SECONDS);
    }

    public AgentConfig withTimeoutSeconds(int seconds) {
        return new AgentConfig(name, role, modelProvider, modelName, modelId, temperature, maxTokens, seconds);
    }
}
