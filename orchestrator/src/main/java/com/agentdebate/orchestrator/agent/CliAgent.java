package com.agentdebate.orchestrator.agent;

import com.agentdebate.orchestrator.model.AgentConfig;
import com.agentdebate.orchestrator.model.ModelProvider;

import java.util.List;

/**
 * One language-model command-line tool an agent can shell out to.
 *
 * An implementation only knows its own argument shape and output quirks;
 * launching, timing out and failure handling belong to {@link AgentRunner}.
 * Implementations are Spring {@code @Component}s and are picked up by
 * {@link CliAgentRegistry} automatically.
 */
public interface CliAgent {

    /** The provider this CLI serves. At most one CliAgent per provider. */
    ModelProvider provider();

    /**
     * Full argument list, executable first. Must encode the resolved model
     * id and the complete prompt as process arguments.
     */
    List<String> buildCommand(AgentConfig config, String prompt);

    /**
     * Turn raw stdout into the response text, dropping anything the CLI
     * prints that is not part of the model's answer.
     */
    default String cleanOutput(String stdout) {
        return stdout == null ? "" : stdout.strip();
    }
}
