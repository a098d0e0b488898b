package com.agentrooms.shared.config;

public record ServiceInfo(String name, String version, String environment) {

    public static ServiceInfo defaults() {
        return new ServiceInfo("agentrooms-api", "0.1.41", "development");
    }
}
