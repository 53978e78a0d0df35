package com.agentdebate.orchestrator.error;

import com.agentdebate.orchestrator.model.DebateRecord;

/**
 * The debate ran to completion but the store rejected it.
 *
 * Carries the assembled record so the caller still gets the three agent
 * responses it paid for, and can retry the save or show the result anyway.
 */
public class DebatePersistenceException extends StorageException {

    private final DebateRecord debate;

    public DebatePersistenceException(DebateRecord debate, Throwable cause) {
        super("Debate " + debate.debateId() + " completed but could not be saved: " + cause.getMessage(), cause);
        this.debate = debate;
    }

    public DebateRecord debate() { return debate; }
}
