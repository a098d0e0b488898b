package com.agentrooms.agent;

import com.agentrooms.providers.ProviderKind;
import com.agentrooms.providers.ProviderRegistry;
import com.agentrooms.shared.model.AgentDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks a route from the {@code @agent} mentions in a message. Mentions are
 * counted as written, so "@a @a" counts as two.
 */
public class RequestClassifier {

    private static final Pattern MENTION = Pattern.compile("@(\\w+(?:-\\w+)*)");

    private final ProviderRegistry registry;

    public RequestClassifier(ProviderRegistry registry) {
        this.registry = registry;
    }

    public static List<String> mentions(String message) {
        var found = new ArrayList<String>();
        if (message == null) return found;
        var m = MENTION.matcher(message);
        while (m.find()) {
            found.add(m.group(1));
        }
        return found;
    }

    public Route classify(String message, List<AgentDescriptor> availableAgents) {
        if (registry.orchestratorKind().filter(k -> k == ProviderKind.LLM_API).isEmpty()) {
            return Route.local();
        }
        var mentioned = mentions(message);
        if (mentioned.size() == 1) {
            var id = mentioned.get(0);
            var target = availableAgents.stream()
                    .filter(a -> a.id().equals(id) && !a.orchestrator() && a.hasEndpoint())
                    .findFirst();
            if (target.isPresent()) return Route.remote(target.get());
        }
        if (mentioned.size() > 1 && !availableAgents.isEmpty()) {
            return Route.orchestrate();
        }
        return Route.local();
    }
}
