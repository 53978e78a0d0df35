package com.agentdebate.orchestrator.service;

import com.agentdebate.orchestrator.agent.AgentRunner;
import com.agentdebate.orchestrator.agent.ClaudeCliAgent;
import com.agentdebate.orchestrator.agent.CliAgentRegistry;
import com.agentdebate.orchestrator.agent.GeminiCliAgent;
import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.AgentResponse;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.model.DebateRole;
import com.agentdebate.orchestrator.model.DebateTopic;
import com.agentdebate.orchestrator.model.ModelProvider;
import com.agentdebate.orchestrator.process.ProcessExecutor;
import com.agentdebate.orchestrator.prompt.DebatePrompts;
import com.agentdebate.orchestrator.store.FileDebateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole pipeline against stub CLIs: real processes, real file store.
 *
 * The stub prints "&lt;ROLE&gt;:&lt;length of its last argument&gt;", deriving
 * the role from the prompt wording, which lets the test check that every
 * prompt was built from exactly the text the previous stage produced.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class DebateEndToEndTest {

    private static final String ECHO_STUB = """
            #!/bin/sh
            for last; do :; done
            case "$last" in
              *"synthesizing a debate"*) role=SYNTHESIS ;;
              *"arguing against"*)       role=AGAINST ;;
              *)                         role=FOR ;;
            esac
            echo "$role:${#last}"
            """;

    private static final String SLOW_STUB = """
            #!/bin/sh
            sleep 30
            echo never
            """;

    private static final DebateTopic TOPIC =
            new DebateTopic("Four day week", "Should companies move to a four day working week?");

    @TempDir Path tmp;

    private final ProcessExecutor processExecutor = new ProcessExecutor();

    @AfterEach
    void tearDown() {
        processExecutor.shutdown();
    }

    @Test
    void fullDebate_threadsEachResponseIntoTheNextPrompt() throws IOException {
        Path stub = script("echo-agent", ECHO_STUB);
        FileDebateStore store = new FileDebateStore(tmp.resolve("debates"), mapper());
        DebateOrchestrator orchestrator = orchestrator(stub.toString(), stub.toString(), store);

        DebateRecord debate = orchestrator.runDebate(TOPIC, DebatePresets.agentsFor("mixed"));

        String forText     = "FOR:" + DebatePrompts.forPrompt(TOPIC).length();
        String againstText = "AGAINST:" + DebatePrompts.againstPrompt(TOPIC, forText).length();
        String synthText   = "SYNTHESIS:" + DebatePrompts.synthesisPrompt(TOPIC, forText, againstText).length();

        assertThat(debate.agentResponses()).extracting(AgentResponse::responseText)
                .containsExactly(forText, againstText, synthText);
        assertThat(debate.agentResponses()).allMatch(AgentResponse::success);
        assertThat(debate.responseFor(DebateRole.AGAINST).modelProvider()).isEqualTo(ModelProvider.GEMINI);

        long slowestStage = debate.agentResponses().stream()
                .mapToLong(AgentResponse::executionTimeMs).max().orElseThrow();
        assertThat(debate.totalExecutionTimeMs()).isGreaterThanOrEqualTo(slowestStage);

        DebateRecord stored = store.get(debate.debateId());
        assertThat(stored.agentResponses()).isEqualTo(debate.agentResponses());
        assertThat(stored.agentsConfig()).isEqualTo(debate.agentsConfig());
        assertThat(stored.createdAt()).isEqualTo(debate.createdAt());
    }

    @Test
    void slowAgent_timesOut_andOtherStagesStillRun() throws IOException {
        Path echo = script("echo-agent", ECHO_STUB);
        Path slow = script("slow-agent", SLOW_STUB);
        FileDebateStore store = new FileDebateStore(tmp.resolve("debates"), mapper());
        DebateOrchestrator orchestrator = orchestrator(echo.toString(), slow.toString(), store);

        List<AgentConfig> agents = List.of(
                AgentConfig.of("Gemini FOR", DebateRole.FOR, ModelProvider.GEMINI, "flash").withTimeoutSeconds(1),
                AgentConfig.of("Claude AGAINST", DebateRole.AGAINST, ModelProvider.CLAUDE, "haiku"),
                AgentConfig.of("Claude SYNTHESIS", DebateRole.SYNTHESIS, ModelProvider.CLAUDE, "haiku"));

        DebateRecord debate = orchestrator.runDebate(TOPIC, agents);

        AgentResponse forResponse = debate.responseFor(DebateRole.FOR);
        assertThat(forResponse.success()).isFalse();
        assertThat(forResponse.errorMessage()).isEqualTo("Agent Gemini FOR timed out after 1s");
        assertThat(forResponse.executionTimeMs()).isGreaterThanOrEqualTo(1000);
        assertThat(forResponse.responseText()).isEmpty();

        // AGAINST saw an empty FOR block
        assertThat(debate.responseFor(DebateRole.AGAINST).responseText())
                .isEqualTo("AGAINST:" + DebatePrompts.againstPrompt(TOPIC, "").length());
        assertThat(debate.responseFor(DebateRole.SYNTHESIS).success()).isTrue();
        assertThat(debate.totalExecutionTimeMs()).isGreaterThanOrEqualTo(forResponse.executionTimeMs());
    }

    @Test
    void missingCli_failsThatStageOnly() throws IOException {
        Path echo = script("echo-agent", ECHO_STUB);
        FileDebateStore store = new FileDebateStore(tmp.resolve("debates"), mapper());
        String missing = tmp.resolve("no-such-gemini").toString();
        DebateOrchestrator orchestrator = orchestrator(echo.toString(), missing, store);

        DebateRecord debate = orchestrator.runDebate(TOPIC, DebatePresets.agentsFor("mixed"));

        AgentResponse against = debate.responseFor(DebateRole.AGAINST);
        assertThat(against.success()).isFalse();
        assertThat(against.errorMessage()).isEqualTo("CLI command not found: " + missing);
        assertThat(against.executionTimeMs()).isZero();
        assertThat(debate.responseFor(DebateRole.SYNTHESIS).success()).isTrue();
        assertThat(store.list(10)).extracting(DebateRecord::debateId).containsExactly(debate.debateId());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DebateOrchestrator orchestrator(String claudeExe, String geminiExe, FileDebateStore store) {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        CliAgentRegistry registry = new CliAgentRegistry(
                List.of(new ClaudeCliAgent(claudeExe), new GeminiCliAgent(geminiExe)));
        AgentRunner runner = new AgentRunner(registry, processExecutor, meters);
        return new DebateOrchestrator(runner, registry, store, meters);
    }

    private Path script(String name, String body) throws IOException {
        Path file = tmp.resolve(name);
        Files.writeString(file, body);
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    private static ObjectMapper mapper() {
        return Jackson2ObjectMapperBuilder.json().build();
    }
}
