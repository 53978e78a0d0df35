package com.agentdebate.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Output of one agent invocation.
 *
 * A response is either successful (no error message) or failed (error
 * message present). A failed response still has a response text, normally
 * empty, which later stages receive as context.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentResponse(
        String        agentName,
        DebateRole    role,
        ModelProvider modelProvider,
        String        modelName,
        String        responseText,
        long          executionTimeMs,
        boolean       success,
        String        errorMessage
) {
    public AgentResponse {
        if (responseText == null) responseText = "";
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("execution_time_ms must be >= 0, got " + executionTimeMs);
        }
        if (success && errorMessage != null) {
            throw new IllegalArgumentException("A successful response cannot carry an error message");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("A failed response must carry an error message");
        }
    }

    public static AgentResponse succeeded(AgentConfig config, String responseText, long executionTimeMs) {
        return new AgentResponse(config.name(), config.role(), config.modelProvider(), config.modelName(),
                responseText, executionTimeMs, true, null);
    }

    public static AgentResponse failed(AgentConfig config, String errorMessage, long executionTimeMs) {
        return new AgentResponse(config.name(), config.role(), config.modelProvider(), config.modelName(),
                "", executionTimeMs, false, errorMessage);
    }
}
