package com.agentdebate.orchestrator.model;

/**
 * The three agent roles in a debate.
 *
 * Declaration order is the execution order. Each role runs once; each feeds
 * its response text into every later role's prompt.
 */
public enum DebateRole {
    FOR,        // Argues in favour of the topic
    AGAINST,    // Counter-argues, addressing the FOR points
    SYNTHESIS   // Weighs both sides and proposes a resolution
}
