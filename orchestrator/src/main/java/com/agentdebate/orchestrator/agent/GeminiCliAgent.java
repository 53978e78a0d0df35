package com.agentdebate.orchestrator.agent;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.ModelProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Gemini CLI: {@code gemini --yolo -m <model_id> <prompt>}.
 *
 * The CLI writes auth chatter such as "Loaded cached credentials." to
 * stdout, mixed in with the answer. Any line mentioning credentials is
 * dropped before the text is used.
 */
@Component
public class GeminiCliAgent implements CliAgent {

    private final String executable;

    public GeminiCliAgent(@Value("${debate.cli.gemini-executable:gemini}") String executable) {
        this.executable = executable;
    }

    @Override
    public ModelProvider provider() { return ModelProvider.GEMINI; }

    @Override
    public List<String> buildCommand(AgentConfig config, String prompt) {
        return List.of(executable, "--yolo", "-m", config.modelId(), prompt);
    }

    @Override
    public String cleanOutput(String stdout) {
        if (stdout == null || stdout.isEmpty()) return "";
        return stdout.lines()
                .filter(line -> !line.toLowerCase(Locale.ROOT).contains("credentials"))
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
