package com.agentrooms.shared.config;

import java.time.Duration;

/**
 * NDJSON transport tuning. A zero heartbeat interval disables heartbeats.
 */
public record StreamConfig(double flushProbability, Duration heartbeatInterval) {

    public StreamConfig {
        if (flushProbability < 0 || flushProbability > 1) {
            throw new IllegalArgumentException("flush-probability must be within [0, 1]: " + flushProbability);
        }
        if (heartbeatInterval == null || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeat-interval must not be negative: " + heartbeatInterval);
        }
    }

    public static StreamConfig defaults() {
        return new StreamConfig(0.3, Duration.ofSeconds(15));
    }
}
