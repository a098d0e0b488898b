package com.agentrooms.gateway.http;

import com.agentrooms.shared.config.AgentRoomsConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final AgentRoomsConfig config;
    private final Clock clock;

    @Autowired
    public HealthController(AgentRoomsConfig config) {
        this(config, Clock.systemUTC());
    }

    HealthController(AgentRoomsConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("service", config.service().name());
        body.put("version", config.service().version());
        body.put("environment", config.service().environment());
        return body;
    }
}
