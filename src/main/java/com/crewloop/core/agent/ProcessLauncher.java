package com.crewloop.core.agent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Spawns operating-system processes. Replaced in tests with an in-memory process.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Path cwd, Map<String, String> env) throws IOException;

    ProcessLauncher SYSTEM = (command, cwd, env) -> {
        var builder = new ProcessBuilder(command);
        if (cwd != null) {
            builder.directory(cwd.toFile());
        }
        builder.environment().putAll(env);
        return builder.start();
    };
}
