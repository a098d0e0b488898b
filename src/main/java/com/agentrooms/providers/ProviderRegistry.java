package com.agentrooms.providers;

import com.agentrooms.shared.model.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Providers keyed by id, plus the agents they serve. Populated at startup,
 * read-only while serving requests.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    public static final String ORCHESTRATOR_AGENT_ID = "orchestrator";
    public static final String IMPLEMENTATION_AGENT_ID = "implementation";

    private final Map<String, AgentProvider> providers = new LinkedHashMap<>();
    private final Map<String, AgentDescriptor> agents = new LinkedHashMap<>();

    public synchronized void register(AgentProvider provider) {
        providers.put(provider.id(), provider);
        log.info("Registered provider {} ({})", provider.id(), provider.kind());
    }

    public synchronized void registerAgent(AgentDescriptor agent) {
        if (agent.provider() != null && !providers.containsKey(agent.provider())) {
            throw new IllegalArgumentException("Unknown provider " + agent.provider() + " for agent " + agent.id());
        }
        if (agent.orchestrator()) {
            orchestrator().filter(existing -> !existing.id().equals(agent.id())).ifPresent(existing -> {
                throw new IllegalArgumentException("Orchestrator already registered: " + existing.id());
            });
        }
        agents.put(agent.id(), agent);
    }

    public synchronized Optional<AgentProvider> provider(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public synchronized Optional<AgentDescriptor> agent(String id) {
        return Optional.ofNullable(agents.get(id));
    }

    public synchronized List<AgentDescriptor> agents() {
        return new ArrayList<>(agents.values());
    }

    public synchronized Optional<AgentProvider> providerForAgent(String agentId) {
        return agent(agentId).map(AgentDescriptor::provider).flatMap(this::provider);
    }

    public synchronized Optional<AgentDescriptor> orchestrator() {
        return agents.values().stream().filter(AgentDescriptor::orchestrator).findFirst();
    }

    /** Kind of the provider behind the {@code orchestrator} agent, if any. */
    public Optional<ProviderKind> orchestratorKind() {
        return providerForAgent(ORCHESTRATOR_AGENT_ID).map(AgentProvider::kind);
    }

    /**
     * Registers the built-in agents: {@code implementation} on the local CLI
     * and {@code orchestrator} on the LLM planner when one is available,
     * otherwise on the local CLI as well.
     */
    public synchronized void initializeDefaults(String workingDirectory) {
        var local = providers.values().stream()
                .filter(p -> p.kind() == ProviderKind.LOCAL_TOOL).findFirst();
        var planner = providers.values().stream()
                .filter(p -> p.kind() == ProviderKind.LLM_API).findFirst();

        local.ifPresent(p -> registerAgent(new AgentDescriptor(IMPLEMENTATION_AGENT_ID, "Implementation Agent",
                "Executes code changes and runs tools in the working directory",
                p.id(), null, workingDirectory, false)));

        var orchestratorProvider = planner.or(() -> local);
        orchestratorProvider.ifPresent(p -> registerAgent(new AgentDescriptor(ORCHESTRATOR_AGENT_ID,
                "Orchestrator Agent", "Plans multi-step work across the available agents",
                p.id(), null, workingDirectory, true)));

        if (orchestratorProvider.isEmpty()) {
            log.warn("No provider available for the orchestrator agent");
        } else {
            log.info("Orchestrator agent served by {}", orchestratorProvider.get().id());
        }
    }
}
