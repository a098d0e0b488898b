package com.agentrooms.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDescriptor(
        String id,
        String name,
        String description,
        String provider,
        String apiEndpoint,
        String workingDirectory,
        @JsonProperty("isOrchestrator") Boolean isOrchestrator
) {

    public static AgentDescriptor worker(String id, String description, String apiEndpoint) {
        return new AgentDescriptor(id, id, description, null, apiEndpoint, null, false);
    }

    public boolean orchestrator() {
        return Boolean.TRUE.equals(isOrchestrator);
    }

    public boolean hasEndpoint() {
        return apiEndpoint != null && !apiEndpoint.isBlank();
    }
}
