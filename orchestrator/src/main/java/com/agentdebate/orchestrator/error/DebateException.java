package com.agentdebate.orchestrator.error;

/**
 * Root of the debate platform's exception hierarchy.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. Agent process failures never surface as a DebateException:
 * the runner turns them into a failed AgentResponse instead.
 */
public class DebateException extends RuntimeException {

    public DebateException(String message) {
        super(message);
    }

    public DebateException(String message, Throwable cause) {
        super(message, cause);
    }
}
