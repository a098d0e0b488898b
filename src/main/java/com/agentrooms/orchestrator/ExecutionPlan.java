package com.agentrooms.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Ordered steps produced by the planner. Only described, never executed here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionPlan(List<PlanStep> steps) {

    public ExecutionPlan {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }
}
