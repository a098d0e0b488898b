package com.agentrooms.shared.config;

import java.time.Duration;

/**
 * Peer delegation timeouts. The read timeout applies to each line of the
 * peer's stream, not to the whole response.
 */
public record RemoteConfig(
        Duration readTimeout,
        Duration connectTimeout
) {
    public static RemoteConfig defaults() {
        return new RemoteConfig(Duration.ofSeconds(30), Duration.ofSeconds(10));
    }
}
