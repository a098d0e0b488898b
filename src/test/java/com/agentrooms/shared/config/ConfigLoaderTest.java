package com.agentrooms.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());

        assertEquals(8080, config.serverPort());
        assertFalse(config.debugMode());
        assertEquals("", config.anthropicApiKey());
        assertEquals(ClaudeConfig.defaults(), config.claude());
        assertEquals(OrchestratorConfig.defaults(), config.orchestrator());
        assertEquals(Duration.ofSeconds(30), config.remote().readTimeout());
        assertEquals(0.3, config.stream().flushProbability());
        assertEquals(Duration.ofSeconds(15), config.stream().heartbeatInterval());
        assertEquals("0.1.41", config.service().version());
    }

    @Test
    void parsesEverySection() throws Exception {
        var yaml = tempDir.resolve("config.yaml");
        Files.writeString(yaml, String.join("\n",
                "server:",
                "  port: 9090",
                "debug-mode: true",
                "claude:",
                "  path: /opt/claude/cli.js",
                "  preload-script: /opt/preload.cjs",
                "  credentials-path: /var/lib/agentrooms/creds.json",
                "api-keys:",
                "  anthropic: sk-file",
                "orchestrator:",
                "  model: claude-opus-4",
                "  max-tokens: 8000",
                "  base-url: http://localhost:9999/",
                "  api-version: \"2023-06-01\"",
                "remote:",
                "  read-timeout: 5",
                "  connect-timeout: 2",
                "stream:",
                "  flush-probability: 0.5",
                "  heartbeat-interval: 0",
                "service:",
                "  name: rooms",
                "  version: 1.2.3",
                "  environment: production",
                ""));

        var config = ConfigLoader.load(yaml, Map.of());

        assertEquals(9090, config.serverPort());
        assertTrue(config.debugMode());
        assertEquals("/opt/claude/cli.js", config.claude().path());
        assertEquals("/opt/preload.cjs", config.claude().preloadScript());
        assertEquals(Path.of("/var/lib/agentrooms/creds.json"), config.claude().credentialsPath());
        assertEquals("sk-file", config.anthropicApiKey());
        assertEquals(new OrchestratorConfig("claude-opus-4", 8000, "http://localhost:9999", "2023-06-01"),
                config.orchestrator());
        assertEquals(new RemoteConfig(Duration.ofSeconds(5), Duration.ofSeconds(2)), config.remote());
        assertEquals(new StreamConfig(0.5, Duration.ZERO), config.stream());
        assertEquals(new ServiceInfo("rooms", "1.2.3", "production"), config.service());
    }

    @Test
    void environmentOverridesFile() throws Exception {
        var yaml = tempDir.resolve("config.yaml");
        Files.writeString(yaml, "api-keys:\n  anthropic: sk-file\nserver:\n  port: 9090\n");

        var config = ConfigLoader.load(yaml, Map.of(
                "CLAUDE_API_KEY", "sk-env",
                "AGENTROOMS_PORT", "7070",
                "CLAUDE_PATH", "/bin/claude",
                "AGENTROOMS_CREDENTIALS_PATH", "~/creds.json",
                "AGENTROOMS_DEBUG", "true"));

        assertEquals("sk-env", config.anthropicApiKey());
        assertEquals(7070, config.serverPort());
        assertEquals("/bin/claude", config.claude().path());
        assertEquals(Path.of(System.getProperty("user.home"), "creds.json"), config.claude().credentialsPath());
        assertTrue(config.debugMode());
    }

    @Test
    void anthropicKeyWinsOverClaudeKey() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"),
                Map.of("ANTHROPIC_API_KEY", "sk-a", "CLAUDE_API_KEY", "sk-c"));
        assertEquals("sk-a", config.anthropicApiKey());
    }

    @Test
    void rejectsOutOfRangeFlushProbability() throws Exception {
        var yaml = tempDir.resolve("config.yaml");
        Files.writeString(yaml, "stream:\n  flush-probability: 1.5\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(yaml, Map.of()));
    }
}
