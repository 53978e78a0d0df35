package com.agentdebate.orchestrator.error;

/**
 * Thrown when a topic or agent set is invalid: wrong agent count, missing or
 * duplicate roles, out-of-range sampling settings, unknown provider.
 *
 * Always raised before any agent process is launched.
 */
public class DebateConfigurationException extends DebateException {

    public DebateConfigurationException(String message) {
        super(message);
    }
}
