package com.agentrooms.agent;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.local.ClaudeCodeProvider;
import com.agentrooms.observability.DispatchMetrics;
import com.agentrooms.orchestrator.AnthropicPlanProvider;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.providers.ProviderRegistry;
import com.agentrooms.remote.RemoteAgentProvider;
import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.shared.model.StreamEvent;
import com.agentrooms.stream.EventStream;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatDispatcherTest {

    private final CancellationRegistry cancellations = new CancellationRegistry();
    private final DispatchMetrics metrics = new DispatchMetrics();

    /** Answers every request with one text event naming itself and the target. */
    private AgentProvider echo(String id, ProviderKind kind) {
        return new AgentProvider() {
            @Override public String id() { return id; }
            @Override public ProviderKind kind() { return kind; }
            @Override
            public EventStream executeChat(ChatRequest request, AgentDescriptor target) {
                return new EventStream(request.requestId(), cancellations) {
                    boolean sent;

                    @Override
                    protected void open() {
                    }

                    @Override
                    protected boolean advance() {
                        if (sent) return false;
                        sent = true;
                        emit(StreamEvent.text(id + (target != null ? ":" + target.id() : "")));
                        return true;
                    }
                };
            }
        };
    }

    private ProviderRegistry fullRegistry() {
        var registry = new ProviderRegistry();
        registry.register(echo(ClaudeCodeProvider.ID, ProviderKind.LOCAL_TOOL));
        registry.register(echo(AnthropicPlanProvider.ID, ProviderKind.LLM_API));
        registry.register(echo(RemoteAgentProvider.ID, ProviderKind.REMOTE_HTTP));
        registry.initializeDefaults("/work");
        return registry;
    }

    private static final List<AgentDescriptor> AGENTS = List.of(
            AgentDescriptor.worker("db-agent", "Database", "http://db:8080"),
            AgentDescriptor.worker("report-agent", "Reports", "http://report:8080"));

    private static List<StreamEvent> drain(Iterator<StreamEvent> events) {
        var out = new ArrayList<StreamEvent>();
        events.forEachRemaining(out::add);
        return out;
    }

    @Test
    void routesEachKindToItsProvider() {
        var dispatcher = new ChatDispatcher(fullRegistry(), cancellations, metrics);

        assertEquals(List.of(StreamEvent.text("claude-code"), StreamEvent.done()),
                drain(dispatcher.dispatch(ChatRequest.of("r1", "fix it").withAgents(AGENTS))));
        assertEquals(List.of(StreamEvent.text("remote-http:db-agent"), StreamEvent.done()),
                drain(dispatcher.dispatch(ChatRequest.of("r2", "@db-agent do X").withAgents(AGENTS))));
        assertEquals(List.of(StreamEvent.text("anthropic"), StreamEvent.done()),
                drain(dispatcher.dispatch(ChatRequest.of("r3", "@db-agent @report-agent do Y").withAgents(AGENTS))));

        assertEquals(1.0, metrics.requests(Route.Kind.LOCAL).count());
        assertEquals(1.0, metrics.requests(Route.Kind.REMOTE_SINGLE).count());
        assertEquals(1.0, metrics.requests(Route.Kind.ORCHESTRATE).count());
        assertEquals(0, cancellations.size());
    }

    @Test
    void multiAgentEndpointAlwaysPlans() {
        var dispatcher = new ChatDispatcher(fullRegistry(), cancellations, metrics);

        var events = drain(dispatcher.dispatchOrchestrated(ChatRequest.of("r1", "no mentions").withAgents(AGENTS)));

        assertEquals(StreamEvent.text("anthropic"), events.get(0));
    }

    @Test
    void missingProviderYieldsErrorStream() {
        var registry = new ProviderRegistry();
        registry.register(echo(AnthropicPlanProvider.ID, ProviderKind.LLM_API));
        registry.initializeDefaults("/work");
        var dispatcher = new ChatDispatcher(registry, cancellations, metrics);

        var events = drain(dispatcher.dispatch(ChatRequest.of("r1", "@db-agent do X").withAgents(AGENTS)));

        assertEquals(List.of(StreamEvent.failed("No provider available for route REMOTE_SINGLE")), events);
        assertEquals(0, cancellations.size());
    }
}
