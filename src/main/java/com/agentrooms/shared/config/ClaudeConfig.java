package com.agentrooms.shared.config;

import java.nio.file.Path;

/**
 * Local Claude Code CLI settings.
 */
public record ClaudeConfig(
        String path,
        String preloadScript,
        Path credentialsPath
) {
    public static ClaudeConfig defaults() {
        return new ClaudeConfig("claude", "",
                Path.of(System.getProperty("user.home"), ".claude-credentials.json"));
    }

    public boolean hasPreloadScript() {
        return preloadScript != null && !preloadScript.isBlank();
    }
}
