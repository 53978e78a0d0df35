package com.agentdebate.orchestrator.process;

/**
 * Outcome of one external process that exited on its own (no timeout).
 *
 * stdout/stderr are already decoded as UTF-8, malformed bytes replaced.
 */
public record ProcessResult(
        int    exitCode,
        String stdout,
        String stderr,
        long   elapsedMs
) {
    public boolean exitedNormally() {
        return exitCode == 0;
    }
}
