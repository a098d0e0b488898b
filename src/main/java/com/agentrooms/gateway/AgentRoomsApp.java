package com.agentrooms.gateway;

import com.agentrooms.shared.config.AgentRoomsConfig;
import com.agentrooms.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.agentrooms")
public class AgentRoomsApp {

    private static final Logger log = LoggerFactory.getLogger(AgentRoomsApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(AgentRoomsApp.class);
        app.setDefaultProperties(Map.of(
            "server.port", config.serverPort(),
            "logging.level.com.agentrooms", config.debugMode() ? "DEBUG" : "INFO"
        ));
        app.addInitializers(provide(config));
        app.run(args);

        if (config.anthropicApiKey().isBlank()) {
            log.warn("Anthropic API key not configured, orchestration falls back to the local CLI. "
                    + "Set api-keys.anthropic in ~/.agentrooms/config.yaml or ANTHROPIC_API_KEY");
        }
        log.info("{} {} ({}) listening on port {}", config.service().name(), config.service().version(),
                config.service().environment(), config.serverPort());
    }

    /** Hands the already loaded config to the context so the file is read once. */
    static ApplicationContextInitializer<ConfigurableApplicationContext> provide(AgentRoomsConfig config) {
        return ctx -> ctx.getBeanFactory().registerSingleton(DispatchWiring.CONFIG_BEAN, config);
    }
}
