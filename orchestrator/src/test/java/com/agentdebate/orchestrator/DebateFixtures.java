package com.agentdebate.orchestrator;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.AgentResponse;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.model.DebateRole;
import com.agentdebate.orchestrator.model.DebateTopic;
import com.agentdebate.orchestrator.model.ModelProvider;

import java.time.Instant;
import java.util.List;

/** Small builders shared by tests that need ready-made debates. */
public final class DebateFixtures {

    public static final DebateTopic TOPIC =
            new DebateTopic("Remote work", "Is remote work better than working in an office?");

    private DebateFixtures() {}

    public static AgentConfig claude(DebateRole role) {
        return AgentConfig.of("Claude " + role, role, ModelProvider.CLAUDE, "haiku");
    }

    public static List<AgentConfig> claudeAgents() {
        return List.of(claude(DebateRole.FOR), claude(DebateRole.AGAINST), claude(DebateRole.SYNTHESIS));
    }

    /** A finished debate where every stage succeeded. */
    public static DebateRecord debate(String id, String title, Instant createdAt) {
        List<AgentConfig> agents = claudeAgents();
        return new DebateRecord(
                id,
                new DebateTopic(title, "Description of " + title),
                agents,
                List.of(
                        AgentResponse.succeeded(agents.get(0), "Remote work saves commuting time.", 1200),
                        AgentResponse.succeeded(agents.get(1), "Offices build team culture.", 1500),
                        AgentResponse.succeeded(agents.get(2), "Hybrid work balances both.", 1800)),
                4600,
                createdAt);
    }

    /** A debate whose AGAINST stage timed out. */
    public static DebateRecord debateWithFailedStage(String id) {
        List<AgentConfig> agents = claudeAgents();
        return new DebateRecord(
                id,
                TOPIC,
                agents,
                List.of(
                        AgentResponse.succeeded(agents.get(0), "Remote work saves commuting time.", 1200),
                        AgentResponse.failed(agents.get(1), "Agent Claude AGAINST timed out after 60s", 60010),
                        AgentResponse.succeeded(agents.get(2), "Only one side was heard.", 900)),
                62110,
                Instant.parse("2026-03-01T10:15:30Z"));
    }
}
