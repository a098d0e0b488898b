package com.agentrooms.shared.config;

public record OrchestratorConfig(
        String model,
        int maxTokens,
        String baseUrl,
        String apiVersion
) {
    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig("claude-sonnet-4-20250514", 4000,
                "https://api.anthropic.com", "2023-06-01");
    }
}
