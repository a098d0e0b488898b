package com.agentrooms.agent;

import com.agentrooms.shared.model.AgentDescriptor;

/**
 * Where a request goes. {@code target} is set only for {@link Kind#REMOTE_SINGLE}.
 */
public record Route(Kind kind, AgentDescriptor target) {

    public enum Kind {
        LOCAL,
        REMOTE_SINGLE,
        ORCHESTRATE
    }

    public static Route local() {
        return new Route(Kind.LOCAL, null);
    }

    public static Route remote(AgentDescriptor target) {
        return new Route(Kind.REMOTE_SINGLE, target);
    }

    public static Route orchestrate() {
        return new Route(Kind.ORCHESTRATE, null);
    }

    @Override
    public String toString() {
        return target != null ? kind + "(" + target.id() + ")" : kind.toString();
    }
}
