package com.agentrooms.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".agentrooms", "config.yaml"
    );

    public static AgentRoomsConfig load() {
        return load(DEFAULT_PATH);
    }

    public static AgentRoomsConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    public static AgentRoomsConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var keys = (Map<String, Object>) raw.getOrDefault("api-keys", Map.of());
        var claude = (Map<String, Object>) raw.getOrDefault("claude", Map.of());
        var orchestrator = (Map<String, Object>) raw.getOrDefault("orchestrator", Map.of());
        var remote = (Map<String, Object>) raw.getOrDefault("remote", Map.of());
        var stream = (Map<String, Object>) raw.getOrDefault("stream", Map.of());
        var service = (Map<String, Object>) raw.getOrDefault("service", Map.of());

        var apiKeys = new HashMap<String, String>();
        keys.forEach((k, v) -> apiKeys.put(k, String.valueOf(v)));
        var envKey = firstNonBlank(env.get("ANTHROPIC_API_KEY"), env.get("CLAUDE_API_KEY"));
        if (envKey != null) apiKeys.put("anthropic", envKey);

        var debug = envOrDefault(env, "AGENTROOMS_DEBUG",
                String.valueOf(raw.getOrDefault("debug-mode", false)));

        return new AgentRoomsConfig(
            Integer.parseInt(envOrDefault(env, "AGENTROOMS_PORT",
                String.valueOf(server.getOrDefault("port", 8080)))),
            Boolean.parseBoolean(debug),
            apiKeys,
            parseClaudeConfig(claude, env),
            parseOrchestratorConfig(orchestrator),
            parseRemoteConfig(remote),
            parseStreamConfig(stream),
            parseServiceInfo(service)
        );
    }

    private static ClaudeConfig parseClaudeConfig(Map<String, Object> claude, Map<String, String> env) {
        var defaults = ClaudeConfig.defaults();
        var credentials = envOrDefault(env, "AGENTROOMS_CREDENTIALS_PATH",
                String.valueOf(claude.getOrDefault("credentials-path", defaults.credentialsPath())));
        return new ClaudeConfig(
            envOrDefault(env, "CLAUDE_PATH", String.valueOf(claude.getOrDefault("path", defaults.path()))),
            String.valueOf(claude.getOrDefault("preload-script", defaults.preloadScript())),
            expandHome(credentials)
        );
    }

    private static OrchestratorConfig parseOrchestratorConfig(Map<String, Object> orchestrator) {
        var defaults = OrchestratorConfig.defaults();
        return new OrchestratorConfig(
            String.valueOf(orchestrator.getOrDefault("model", defaults.model())),
            Integer.parseInt(String.valueOf(orchestrator.getOrDefault("max-tokens", defaults.maxTokens()))),
            String.valueOf(orchestrator.getOrDefault("base-url", defaults.baseUrl())).replaceAll("/+$", ""),
            String.valueOf(orchestrator.getOrDefault("api-version", defaults.apiVersion()))
        );
    }

    private static RemoteConfig parseRemoteConfig(Map<String, Object> remote) {
        var defaults = RemoteConfig.defaults();
        return new RemoteConfig(
            Duration.ofSeconds(Long.parseLong(String.valueOf(
                remote.getOrDefault("read-timeout", defaults.readTimeout().toSeconds())))),
            Duration.ofSeconds(Long.parseLong(String.valueOf(
                remote.getOrDefault("connect-timeout", defaults.connectTimeout().toSeconds()))))
        );
    }

    private static StreamConfig parseStreamConfig(Map<String, Object> stream) {
        var defaults = StreamConfig.defaults();
        return new StreamConfig(
            Double.parseDouble(String.valueOf(
                stream.getOrDefault("flush-probability", defaults.flushProbability()))),
            Duration.ofSeconds(Long.parseLong(String.valueOf(
                stream.getOrDefault("heartbeat-interval", defaults.heartbeatInterval().toSeconds()))))
        );
    }

    private static ServiceInfo parseServiceInfo(Map<String, Object> service) {
        var defaults = ServiceInfo.defaults();
        return new ServiceInfo(
            String.valueOf(service.getOrDefault("name", defaults.name())),
            String.valueOf(service.getOrDefault("version", defaults.version())),
            String.valueOf(service.getOrDefault("environment", defaults.environment()))
        );
    }

    private static Path expandHome(String path) {
        if (path.equals("~")) return Path.of(System.getProperty("user.home"));
        if (path.startsWith("~/")) return Path.of(System.getProperty("user.home"), path.substring(2));
        return Path.of(path);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first;
        if (second != null && !second.isBlank()) return second;
        return null;
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null ? val : fallback;
    }
}
