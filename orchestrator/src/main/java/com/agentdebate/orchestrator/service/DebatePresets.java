package com.agentdebate.orchestrator.service;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.DebateRole;
import com.agentdebate.orchestrator.model.ModelProvider;

import java.util.List;
import java.util.Locale;

/**
 * Ready-made agent line-ups, for callers that only want to pick a provider.
 *
 *   claude: Claude haiku in all three roles
 *   gemini: Gemini flash in all three roles
 *   mixed: Claude FOR, Gemini AGAINST, Claude SYNTHESIS
 */
public final class DebatePresets {

    public static final String DEFAULT_PRESET = "claude";

    private static final String CLAUDE_MODEL = "haiku";
    private static final String GEMINI_MODEL = "flash";

    private DebatePresets() {}

    public static List<AgentConfig> agentsFor(String preset) {
        String name = preset == null || preset.isBlank() ? DEFAULT_PRESET : preset.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "claude" -> List.of(
                    claude(DebateRole.FOR), claude(DebateRole.AGAINST), claude(DebateRole.SYNTHESIS));
            case "gemini" -> List.of(
                    gemini(DebateRole.FOR), gemini(DebateRole.AGAINST), gemini(DebateRole.SYNTHESIS));
            case "mixed" -> List.of(
                    claude(DebateRole.FOR), gemini(DebateRole.AGAINST), claude(DebateRole.SYNTHESIS));
            default -> throw new DebateConfigurationException(
                    "Unknown provider preset '" + preset + "' (expected claude, gemini or mixed)");
        };
    }

    private static AgentConfig claude(DebateRole role) {
        return AgentConfig.of("Claude " + role, role, ModelProvider.CLAUDE, CLAUDE_MODEL);
    }

    private static AgentConfig gemini(DebateRole role) {
        return AgentConfig.of("Gemini " + role, role, ModelProvider.GEMINI, GEMINI_MODEL);
    }
}
