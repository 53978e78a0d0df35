package com.agentdebate.orchestrator.agent;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.ModelProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Claude Code CLI in non-interactive mode:
 * {@code claude --model <model_id> --print <prompt>}.
 */
@Component
public class ClaudeCliAgent implements CliAgent {

    private final String executable;

    public ClaudeCliAgent(@Value("${debate.cli.claude-executable:claude}") String executable) {
        this.executable = executable;
    }

    @Override
    public ModelProvider provider() { return ModelProvider.CLAUDE; }

    @Override
    public List<String> buildCommand(AgentConfig config, String prompt) {
        return List.of(executable, "--model", config.modelId(), "--print", prompt);
    }
}
