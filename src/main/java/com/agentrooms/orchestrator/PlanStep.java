package com.agentrooms.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanStep(
        String id,
        String agent,
        String message,
        @JsonProperty("output_file") String outputFile,
        List<String> dependencies
) {
    public PlanStep {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }
}
