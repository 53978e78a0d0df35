package com.agentdebate.orchestrator.model;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * The language-model CLIs an agent can be backed by.
 *
 * Each provider carries the alias table used to turn a short model name
 * ("haiku", "flash") into the full model id passed on the command line.
 * Names missing from the table fall back to "&lt;provider&gt;-&lt;name&gt;".
 */
public enum ModelProvider {

    CLAUDE("claude", Map.of(
            "haiku",  "claude-haiku-4-5-20251001",
            "sonnet", "claude-sonnet-4-5-20250929",
            "opus",   "claude-opus-4-5-20251101")),

    GEMINI("gemini", Map.of(
            "flash-lite", "gemini-2.5-flash-lite",
            "flash",      "gemini-2.5-flash",
            "pro",        "gemini-2.5-pro"));

    private final String              id;
    private final Map<String, String> modelIds;

    ModelProvider(String id, Map<String, String> modelIds) {
        this.id       = id;
        this.modelIds = modelIds;
    }

    @JsonValue
    public String id() { return id; }

    public String resolveModelId(String modelName) {
        String mapped = modelIds.get(modelName);
        return mapped != null ? mapped : id + "-" + modelName;
    }

    @JsonCreator
    public static ModelProvider fromId(String value) {
        if (value == null) {
            throw new DebateConfigurationException("Model provider is required");
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(wanted))
                .findFirst()
                .orElseThrow(() -> new DebateConfigurationException("Unknown provider: " + value));
    }
}
