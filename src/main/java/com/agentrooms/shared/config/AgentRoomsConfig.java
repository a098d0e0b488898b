package com.agentrooms.shared.config;

import java.util.Map;

public record AgentRoomsConfig(
        int serverPort,
        boolean debugMode,
        Map<String, String> apiKeys,
        ClaudeConfig claude,
        OrchestratorConfig orchestrator,
        RemoteConfig remote,
        StreamConfig stream,
        ServiceInfo service
) {
    public AgentRoomsConfig {
        apiKeys = apiKeys != null ? Map.copyOf(apiKeys) : Map.of();
    }

    public static AgentRoomsConfig defaults() {
        return new AgentRoomsConfig(8080, false, Map.of(), ClaudeConfig.defaults(),
                OrchestratorConfig.defaults(), RemoteConfig.defaults(),
                StreamConfig.defaults(), ServiceInfo.defaults());
    }

    public String anthropicApiKey() {
        return apiKeys.getOrDefault("anthropic", "");
    }
}
