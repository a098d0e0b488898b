package com.agentrooms.local;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface ProcessLauncher {

    /**
     * @param environment the complete child environment, nothing is inherited
     */
    Process launch(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException;

    static ProcessLauncher system() {
        return (command, workingDirectory, environment) -> {
            var pb = new ProcessBuilder(command);
            pb.redirectErrorStream(false);
            if (workingDirectory != null) pb.directory(workingDirectory.toFile());
            pb.environment().clear();
            pb.environment().putAll(environment);
            return pb.start();
        };
    }
}
