package com.agentdebate.orchestrator.agent;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.agentdebate.orchestrator.model.ModelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of {@link CliAgent}s by provider.
 *
 * Spring collects every CliAgent bean and passes the list here. Adding a
 * provider only requires a new enum constant and a {@code @Component}.
 */
@Component
public class CliAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(CliAgentRegistry.class);

    private final Map<ModelProvider, CliAgent> agents = new EnumMap<>(ModelProvider.class);

    public CliAgentRegistry(List<CliAgent> allAgents) {
        for (CliAgent agent : allAgents) {
            CliAgent previous = agents.put(agent.provider(), agent);
            if (previous != null) {
                throw new IllegalStateException("Two CLI agents registered for provider '"
                        + agent.provider().id() + "': " + previous.getClass().getSimpleName()
                        + " and " + agent.getClass().getSimpleName());
            }
            log.info("Registered CLI agent for provider '{}' ({})",
                    agent.provider().id(), agent.getClass().getSimpleName());
        }
    }

    public CliAgent get(ModelProvider provider) {
        CliAgent agent = agents.get(provider);
        if (agent == null) {
            throw new DebateConfigurationException("No CLI agent registered for provider: "
                    + (provider == null ? null : provider.id()));
        }
        return agent;
    }

    public boolean supports(ModelProvider provider) {
        return agents.containsKey(provider);
    }
}
