package com.agentrooms.gateway;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.agent.ChatDispatcher;
import com.agentrooms.auth.CredentialStore;
import com.agentrooms.local.ClaudeCodeProvider;
import com.agentrooms.observability.DispatchMetrics;
import com.agentrooms.orchestrator.AnthropicPlanProvider;
import com.agentrooms.providers.ProviderRegistry;
import com.agentrooms.remote.RemoteAgentProvider;
import com.agentrooms.shared.config.AgentRoomsConfig;
import com.agentrooms.shared.config.ConfigLoader;
import com.agentrooms.stream.NdjsonStreamWriter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchWiring {

    static final String CONFIG_BEAN = "agentRoomsConfig";

    // Only when the context was started without AgentRoomsApp.main
    @Bean(CONFIG_BEAN)
    @ConditionalOnMissingBean(AgentRoomsConfig.class)
    public AgentRoomsConfig agentRoomsConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public CancellationRegistry cancellationRegistry() {
        return new CancellationRegistry();
    }

    @Bean
    public CredentialStore credentialStore(AgentRoomsConfig config) {
        return new CredentialStore(config.claude().credentialsPath());
    }

    @Bean
    public DispatchMetrics dispatchMetrics() {
        return new DispatchMetrics();
    }

    @Bean
    public ProviderRegistry providerRegistry(AgentRoomsConfig config, CredentialStore credentials,
                                             CancellationRegistry cancellations) {
        var registry = new ProviderRegistry();
        var apiKey = config.anthropicApiKey();
        if (!config.claude().path().isBlank()) {
            registry.register(new ClaudeCodeProvider(config.claude(), apiKey, credentials, cancellations));
        }
        if (!apiKey.isBlank()) {
            registry.register(new AnthropicPlanProvider(apiKey, config.orchestrator(), cancellations));
        }
        registry.register(new RemoteAgentProvider(config.remote(), cancellations));
        registry.initializeDefaults(System.getProperty("user.dir"));
        return registry;
    }

    @Bean
    public ChatDispatcher chatDispatcher(ProviderRegistry registry, CancellationRegistry cancellations,
                                         DispatchMetrics metrics) {
        return new ChatDispatcher(registry, cancellations, metrics);
    }

    @Bean
    public NdjsonStreamWriter ndjsonStreamWriter(AgentRoomsConfig config) {
        return new NdjsonStreamWriter(config.stream().flushProbability(), config.stream().heartbeatInterval());
    }
}
