package com.agentrooms.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
        String message,
        String requestId,
        String sessionId,
        String workingDirectory,
        List<String> allowedTools,
        List<AgentDescriptor> availableAgents,
        ClaudeAuth claudeAuth
) {

    public ChatRequest {
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : List.of();
        availableAgents = availableAgents != null ? List.copyOf(availableAgents) : List.of();
    }

    public static ChatRequest of(String requestId, String message) {
        return new ChatRequest(message, requestId, null, null, null, null, null);
    }

    public ChatRequest withAgents(List<AgentDescriptor> agents) {
        return new ChatRequest(message, requestId, sessionId, workingDirectory, allowedTools, agents, claudeAuth);
    }

    public ChatRequest withSession(String sessionId) {
        return new ChatRequest(message, requestId, sessionId, workingDirectory, allowedTools, availableAgents, claudeAuth);
    }

    public ChatRequest withWorkingDirectory(String workingDirectory) {
        return new ChatRequest(message, requestId, sessionId, workingDirectory, allowedTools, availableAgents, claudeAuth);
    }

    public ChatRequest withAuth(ClaudeAuth claudeAuth) {
        return new ChatRequest(message, requestId, sessionId, workingDirectory, allowedTools, availableAgents, claudeAuth);
    }

    public ChatRequest withAllowedTools(List<String> allowedTools) {
        return new ChatRequest(message, requestId, sessionId, workingDirectory, allowedTools, availableAgents, claudeAuth);
    }
}
