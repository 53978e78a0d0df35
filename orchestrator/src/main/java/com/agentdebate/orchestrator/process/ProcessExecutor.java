package com.agentdebate.orchestrator.process;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one external executable to completion or until its timeout.
 *
 * For each call:
 *   1. Launch the process with stdin closed
 *   2. Drain stdout and stderr on two reader tasks, so a chatty process
 *      never blocks on a full pipe
 *   3. Race process exit against the timeout; on expiry kill the whole
 *      process tree and wait for it to be gone before returning
 *
 * Each call owns its process handle, buffers and timer, so concurrent calls
 * do not interfere. Elapsed times use the monotonic clock.
 */
@Component
public class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    // How long to keep reading the pipes after the process itself has exited.
    // A grandchild that inherited stdout can hold the pipe open indefinitely.
    private static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(10);

    private final ExecutorService streamReaders = Executors.newCachedThreadPool(readerThreads());
    private final Duration        drainGrace;

    public ProcessExecutor() {
        this(DEFAULT_DRAIN_GRACE);
    }

    ProcessExecutor(Duration drainGrace) {
        this.drainGrace = drainGrace;
    }

    /**
     * Run {@code command} and wait for it to exit.
     *
     * @throws ProcessExecutionException with kind COMMAND_NOT_FOUND if the
     *         executable cannot be launched, TIMEOUT if it outlives
     *         {@code timeout}, EXECUTION_ERROR for anything else
     */
    public ProcessResult run(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must contain at least the executable");
        }

        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ProcessExecutionException(ProcessExecutionException.Kind.COMMAND_NOT_FOUND,
                    "CLI command not found: " + command.get(0), 0, e);
        }
        log.debug("Launched '{}' (pid={}, timeout={}s)", command.get(0), process.pid(), timeout.toSeconds());
        closeStdin(process);

        Future<byte[]> stdout = streamReaders.submit(() -> readFully(process.getInputStream()));
        Future<byte[]> stderr = streamReaders.submit(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                terminate(process);
                long elapsed = elapsedMs(start);
                stdout.cancel(true);
                stderr.cancel(true);
                log.warn("'{}' (pid={}) killed after exceeding its {}s timeout",
                        command.get(0), process.pid(), timeout.toSeconds());
                throw new ProcessExecutionException(ProcessExecutionException.Kind.TIMEOUT,
                        "Process timed out after " + timeout.toSeconds() + "s", elapsed);
            }
            long elapsed = elapsedMs(start);

            String out = decode(stdout.get(drainGrace.toMillis(), TimeUnit.MILLISECONDS));
            String err = decode(stderr.get(drainGrace.toMillis(), TimeUnit.MILLISECONDS));
            return new ProcessResult(process.exitValue(), out, err, elapsed);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProcessExecutionException(ProcessExecutionException.Kind.EXECUTION_ERROR,
                    "Interrupted while waiting for '" + command.get(0) + "'", elapsedMs(start), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ProcessExecutionException(ProcessExecutionException.Kind.EXECUTION_ERROR,
                    "Could not read output of '" + command.get(0) + "': " + cause.getMessage(),
                    elapsedMs(start), cause);
        } catch (TimeoutException e) {
            // Whatever still holds the pipes is killed; the readers are abandoned.
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            stdout.cancel(true);
            stderr.cancel(true);
            log.warn("'{}' (pid={}) exited but its output stayed open for {} ms; abandoning readers",
                    command.get(0), process.pid(), drainGrace.toMillis());
            throw new ProcessExecutionException(ProcessExecutionException.Kind.EXECUTION_ERROR,
                    "Output of '" + command.get(0) + "' still open " + drainGrace.toMillis()
                            + " ms after the process exited", elapsedMs(start), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Kill the process and everything it spawned, then wait until the
     * process is really gone.
     */
    private static void terminate(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor();
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static byte[] readFully(InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }

    // new String(bytes, UTF_8) substitutes U+FFFD for malformed input, never throws.
    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static ThreadFactory readerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "agent-stream-reader-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
