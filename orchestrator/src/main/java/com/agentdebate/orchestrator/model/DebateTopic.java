package com.agentdebate.orchestrator.model;

import com.agentdebate.orchestrator.error.DebateConfigurationException;

/**
 * What the three agents argue about. Supplied once per debate.
 */
public record DebateTopic(String title, String description) {

    public DebateTopic {
        if (title == null || title.isBlank()) {
            throw new DebateConfigurationException("Debate topic title must not be blank");
        }
        if (description == null || description.isBlank()) {
            throw new DebateConfigurationException("Debate topic description must not be blank");
        }
    }
}
