package com.agentdebate.orchestrator.error;

public class DebateNotFoundException extends StorageException {

    private final String debateId;

    public DebateNotFoundException(String debateId) {
        super("Debate " + debateId + " not found");
        this.debateId = debateId;
    }

    public String debateId() { return debateId; }
}
