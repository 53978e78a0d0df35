package com.agentdebate.orchestrator.process;

/**
 * Thrown by {@link ProcessExecutor} when a process could not produce a result.
 *
 * elapsedMs is the wall time spent before giving up: zero when the
 * executable could not be launched, time until confirmed termination on
 * timeout.
 */
public class ProcessExecutionException extends RuntimeException {

    public enum Kind { TIMEOUT, COMMAND_NOT_FOUND, EXECUTION_ERROR }

    private final Kind kind;
    private final long elapsedMs;

    public ProcessExecutionException(Kind kind, String message, long elapsedMs) {
        super(message);
        this.kind      = kind;
        this.elapsedMs = elapsedMs;
    }

    public ProcessExecutionException(Kind kind, String message, long elapsedMs, Throwable cause) {
        super(message, cause);
        this.kind      = kind;
        this.elapsedMs = elapsedMs;
    }

    public Kind getKind()      { return kind; }
    public long getElapsedMs() { return elapsedMs; }
}
