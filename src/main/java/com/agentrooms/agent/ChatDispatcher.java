package com.agentrooms.agent;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.local.ClaudeCodeProvider;
import com.agentrooms.observability.DispatchMetrics;
import com.agentrooms.orchestrator.AnthropicPlanProvider;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.providers.ProviderRegistry;
import com.agentrooms.remote.RemoteAgentProvider;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Routes a chat request to one provider and hands back its event stream.
 */
public class ChatDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChatDispatcher.class);

    private final ProviderRegistry registry;
    private final RequestClassifier classifier;
    private final CancellationRegistry cancellations;
    private final DispatchMetrics metrics;

    public ChatDispatcher(ProviderRegistry registry, CancellationRegistry cancellations, DispatchMetrics metrics) {
        this.registry = registry;
        this.classifier = new RequestClassifier(registry);
        this.cancellations = cancellations;
        this.metrics = metrics;
    }

    public EventStream dispatch(ChatRequest request) {
        return start(request, classifier.classify(request.message(), request.availableAgents()));
    }

    /** Plans across the request's agents regardless of mentions. */
    public EventStream dispatchOrchestrated(ChatRequest request) {
        return start(request, Route.orchestrate());
    }

    private EventStream start(ChatRequest request, Route route) {
        log.info("Routing request {} via {}", request.requestId(), route);
        metrics.requests(route.kind()).increment();
        var provider = providerFor(route);
        if (provider.isEmpty()) {
            log.warn("No provider available for route {}", route);
            return EventStream.failing(request.requestId(), cancellations,
                    "No provider available for route " + route.kind());
        }
        return provider.get().executeChat(request, route.target());
    }

    private Optional<AgentProvider> providerFor(Route route) {
        switch (route.kind()) {
            case REMOTE_SINGLE:
                return registry.provider(RemoteAgentProvider.ID);
            case ORCHESTRATE:
                return registry.providerForAgent(ProviderRegistry.ORCHESTRATOR_AGENT_ID)
                        .filter(p -> p.kind() == ProviderKind.LLM_API)
                        .or(() -> registry.provider(AnthropicPlanProvider.ID));
            default:
                return registry.provider(ClaudeCodeProvider.ID);
        }
    }
}
