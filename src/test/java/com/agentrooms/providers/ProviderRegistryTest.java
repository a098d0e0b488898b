package com.agentrooms.providers;

import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.stream.EventStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRegistryTest {

    private static AgentProvider stub(String id, ProviderKind kind) {
        return new AgentProvider() {
            @Override public String id() { return id; }
            @Override public ProviderKind kind() { return kind; }
            @Override public EventStream executeChat(ChatRequest request, AgentDescriptor target) {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Test
    void defaultsPreferTheLlmPlannerForTheOrchestrator() {
        var registry = new ProviderRegistry();
        registry.register(stub("claude-code", ProviderKind.LOCAL_TOOL));
        registry.register(stub("anthropic", ProviderKind.LLM_API));
        registry.register(stub("remote-http", ProviderKind.REMOTE_HTTP));
        registry.initializeDefaults("/work");

        assertEquals("claude-code", registry.agent("implementation").orElseThrow().provider());
        var orchestrator = registry.orchestrator().orElseThrow();
        assertEquals("orchestrator", orchestrator.id());
        assertEquals("anthropic", orchestrator.provider());
        assertEquals(ProviderKind.LLM_API, registry.orchestratorKind().orElseThrow());
        assertEquals(2, registry.agents().size());
    }

    @Test
    void orchestratorFallsBackToLocalProvider() {
        var registry = new ProviderRegistry();
        registry.register(stub("claude-code", ProviderKind.LOCAL_TOOL));
        registry.initializeDefaults("/work");

        assertEquals("claude-code", registry.orchestrator().orElseThrow().provider());
        assertEquals(ProviderKind.LOCAL_TOOL, registry.orchestratorKind().orElseThrow());
    }

    @Test
    void rejectsSecondOrchestrator() {
        var registry = new ProviderRegistry();
        registry.register(stub("anthropic", ProviderKind.LLM_API));
        registry.registerAgent(new AgentDescriptor("orchestrator", "O", "", "anthropic", null, null, true));

        assertThrows(IllegalArgumentException.class, () -> registry.registerAgent(
                new AgentDescriptor("planner-2", "P", "", "anthropic", null, null, true)));
        registry.registerAgent(new AgentDescriptor("orchestrator", "O2", "", "anthropic", null, null, true));
        assertEquals("O2", registry.orchestrator().orElseThrow().name());
    }

    @Test
    void rejectsAgentOfUnknownProvider() {
        var registry = new ProviderRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.registerAgent(
                new AgentDescriptor("a", "A", "", "missing", null, null, false)));
    }

    @Test
    void lookupsAreEmptyWhenNothingRegistered() {
        var registry = new ProviderRegistry();
        assertTrue(registry.provider("anthropic").isEmpty());
        assertTrue(registry.providerForAgent("orchestrator").isEmpty());
        assertTrue(registry.orchestratorKind().isEmpty());
    }
}
