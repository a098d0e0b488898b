package com.agentrooms.local;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything the CLI child process needs, built per request so the server's
 * own environment is never touched.
 */
public record LocalExecutionContext(
        Map<String, String> environment,
        String cliPath,
        Path workingDirectory
) {
    public LocalExecutionContext {
        environment = Map.copyOf(environment);
    }
}
