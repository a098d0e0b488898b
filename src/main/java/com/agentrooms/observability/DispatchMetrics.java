package com.agentrooms.observability;

import com.agentrooms.agent.Route;
import com.agentrooms.shared.model.StreamEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

public class DispatchMetrics {

    private final MeterRegistry registry;

    public DispatchMetrics() {
        this(new SimpleMeterRegistry());
    }

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter requests(Route.Kind route) {
        return Counter.builder("agentrooms.dispatch.requests")
                .tag("route", route.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    /** Outcome is the terminal event type, or {@code disconnected}. */
    public Counter outcomes(String outcome) {
        return Counter.builder("agentrooms.dispatch.outcomes")
                .tag("outcome", outcome)
                .register(registry);
    }

    public Counter abortSignals(boolean found) {
        return Counter.builder("agentrooms.abort.signals")
                .tag("found", String.valueOf(found))
                .register(registry);
    }

    public Timer streamDuration() {
        return Timer.builder("agentrooms.dispatch.duration").register(registry);
    }

    public void recordOutcome(StreamEvent terminal) {
        outcomes(terminal != null ? terminal.type() : "disconnected").increment();
    }
}
