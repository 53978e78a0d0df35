package com.agentdebate.orchestrator.agent;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.AgentResponse;
import com.agentdebate.orchestrator.process.ProcessExecutionException;
import com.agentdebate.orchestrator.process.ProcessExecutor;
import com.agentdebate.orchestrator.process.ProcessResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Runs one agent: (config, prompt) in, {@link AgentResponse} out.
 *
 * This method never throws. Every failure (timeout, missing executable,
 * unreadable output, a bug in a CLI adapter) becomes a response with
 * success=false.
 *
 * Every call is timed and counted:
 * <pre>
 *   debate.agent.duration{provider, role}
 *   debate.agent.calls{provider, role, status="success|timeout|command_not_found|error"}
 * </pre>
 */
@Component
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final CliAgentRegistry registry;
    private final ProcessExecutor  processExecutor;
    private final MeterRegistry    meterRegistry;

    public AgentRunner(CliAgentRegistry registry,
                       ProcessExecutor processExecutor,
                       MeterRegistry meterRegistry) {
        this.registry        = registry;
        this.processExecutor = processExecutor;
        this.meterRegistry   = meterRegistry;
    }

    public AgentResponse execute(AgentConfig config, String prompt) {
        MDC.put("role", config.role().name());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            CliAgent cli = registry.get(config.modelProvider());
            List<String> command = cli.buildCommand(config, prompt);
            log.info("Running agent '{}' ({} / {}), prompt {} chars",
                    config.name(), config.modelProvider().id(), config.modelId(), prompt.length());

            ProcessResult result = processExecutor.run(command, Duration.ofSeconds(config.timeoutSeconds()));

            // A non-zero exit is not a failure on its own: some CLIs exit 1 after
            // printing a perfectly usable answer.
            if (!result.exitedNormally()) {
                log.warn("Agent '{}' exited with code {}; stderr: {}",
                        config.name(), result.exitCode(), result.stderr().strip());
            } else if (!result.stderr().isBlank()) {
                log.debug("Agent '{}' stderr: {}", config.name(), result.stderr().strip());
            }

            String text = cli.cleanOutput(result.stdout());
            log.info("Agent '{}' answered in {} ms ({} chars)", config.name(), result.elapsedMs(), text.length());
            return AgentResponse.succeeded(config, text, result.elapsedMs());

        } catch (ProcessExecutionException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            String message = switch (e.getKind()) {
                case TIMEOUT -> "Agent " + config.name() + " timed out after " + config.timeoutSeconds() + "s";
                case COMMAND_NOT_FOUND, EXECUTION_ERROR -> e.getMessage();
            };
            long elapsed = e.getKind() == ProcessExecutionException.Kind.COMMAND_NOT_FOUND ? 0 : e.getElapsedMs();
            log.warn("Agent '{}' failed [{}]: {}", config.name(), e.getKind(), message);
            return AgentResponse.failed(config, message, elapsed);

        } catch (Exception e) {
            status = "error";
            log.error("Unexpected error running agent '{}'", config.name(), e);
            return AgentResponse.failed(config, describe(e), 0);

        } finally {
            sample.stop(meterRegistry.timer("debate.agent.duration",
                    "provider", config.modelProvider().id(), "role", config.role().name()));
            meterRegistry.counter("debate.agent.calls",
                    "provider", config.modelProvider().id(), "role", config.role().name(),
                    "status", status).increment();
            MDC.remove("role");
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
