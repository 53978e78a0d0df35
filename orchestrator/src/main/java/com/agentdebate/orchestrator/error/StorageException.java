package com.agentdebate.orchestrator.error;

/**
 * Thrown when a debate store cannot read or write a record.
 */
public class StorageException extends DebateException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
