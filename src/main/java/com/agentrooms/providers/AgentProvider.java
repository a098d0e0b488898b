package com.agentrooms.providers;

import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.stream.EventStream;

public interface AgentProvider {

    String id();

    ProviderKind kind();

    /**
     * Starts nothing until the returned stream is first pulled.
     *
     * @param target the agent the request is addressed to, may be null for local runs
     */
    EventStream executeChat(ChatRequest request, AgentDescriptor target);
}
