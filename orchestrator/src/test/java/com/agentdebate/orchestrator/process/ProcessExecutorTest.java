package com.agentdebate.orchestrator.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Runs real /bin/sh processes, so POSIX only.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessExecutorTest {

    private final ProcessExecutor executor = new ProcessExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void capturesStdoutStderrAndExitCode() {
        ProcessResult result = executor.run(
                List.of("sh", "-c", "echo answer; echo oops >&2; exit 3"), Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("answer\n");
        assertThat(result.stderr()).isEqualTo("oops\n");
        assertThat(result.exitedNormally()).isFalse();
        assertThat(result.elapsedMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void argumentsArePassedWithoutShellInterpretation() {
        String prompt = "multi\nline \"quoted\" $HOME `date` ; rm -rf /";

        ProcessResult result = executor.run(
                List.of("sh", "-c", "printf '%s' \"$1\"", "sh", prompt), Duration.ofSeconds(10));

        assertThat(result.stdout()).isEqualTo(prompt);
    }

    @Test
    void largeOutput_doesNotDeadlock() {
        // Well past the 64 KiB pipe buffer on both streams.
        ProcessResult result = executor.run(
                List.of("sh", "-c", "i=0; while [ $i -lt 20000 ]; do echo 0123456789; echo e >&2; i=$((i+1)); done"),
                Duration.ofSeconds(30));

        assertThat(result.stdout()).hasSize(20000 * 11);
        assertThat(result.exitedNormally()).isTrue();
    }

    @Test
    void invalidUtf8_isReplacedNotRejected() {
        ProcessResult result = executor.run(
                List.of("sh", "-c", "printf 'ok \\377 end'"), Duration.ofSeconds(10));

        assertThat(result.stdout()).isEqualTo("ok \uFFFD end");
    }

    @Test
    void timeout_killsProcessAndReportsElapsedTime() {
        long start = System.nanoTime();

        Throwable thrown = catchThrowable(
                () -> executor.run(List.of("sh", "-c", "sleep 30"), Duration.ofSeconds(1)));

        assertThat(thrown).isInstanceOf(ProcessExecutionException.class);
        ProcessExecutionException e = (ProcessExecutionException) thrown;
        long wallMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(e.getKind()).isEqualTo(ProcessExecutionException.Kind.TIMEOUT);
        assertThat(e.getMessage()).isEqualTo("Process timed out after 1s");
        assertThat(e.getElapsedMs()).isBetween(1000L, wallMs);
        assertThat(wallMs).isLessThan(10_000);
    }

    @Test
    void outputHeldOpenAfterExit_failsAfterDrainGrace() {
        ProcessExecutor shortGrace = new ProcessExecutor(Duration.ofMillis(300));
        long start = System.nanoTime();
        try {
            // The backgrounded sleep inherits stdout and keeps the pipe open after sh exits.
            Throwable thrown = catchThrowable(() -> shortGrace.run(
                    List.of("sh", "-c", "sleep 3 & echo started"), Duration.ofSeconds(10)));

            assertThat(thrown).isInstanceOf(ProcessExecutionException.class)
                    .hasMessageContaining("still open 300 ms after the process exited");
            assertThat(((ProcessExecutionException) thrown).getKind())
                    .isEqualTo(ProcessExecutionException.Kind.EXECUTION_ERROR);
            assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(2_500);
        } finally {
            shortGrace.shutdown();
        }
    }

    @Test
    void missingExecutable_isCommandNotFound() {
        Throwable thrown = catchThrowable(() -> executor.run(
                List.of("/nonexistent/definitely-not-a-cli", "--print", "hi"), Duration.ofSeconds(5)));

        assertThat(thrown)
                .isInstanceOf(ProcessExecutionException.class)
                .hasMessage("CLI command not found: /nonexistent/definitely-not-a-cli");
        ProcessExecutionException e = (ProcessExecutionException) thrown;
        assertThat(e.getKind()).isEqualTo(ProcessExecutionException.Kind.COMMAND_NOT_FOUND);
        assertThat(e.getElapsedMs()).isZero();
    }

    @Test
    void emptyCommand_rejected() {
        assertThatThrownBy(() -> executor.run(List.of(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
