package com.crewloop.core.health;

import com.crewloop.config.CrewloopProperties;
import com.crewloop.core.persistence.FileIterationStateStore;
import com.crewloop.core.persistence.IterationStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CrewloopProperties properties;
    private final IterationStateStore stateStore;

    public HealthCheckService(CrewloopProperties properties,
                              @Autowired(required = false) IterationStateStore stateStore) {
        this.properties = properties;
        this.stateStore = stateStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkAgent());
        results.add(checkTaskSource());
        results.add(checkStateStore());
        return results;
    }

    HealthStatus checkGit() {
        Path workspace = properties.getWorkspacePath();
        String version = probe(List.of("git", "--version"), workspace);
        if (version == null) {
            return HealthStatus.down("git", "git not found on PATH");
        }
        if (!Files.isDirectory(workspace.resolve(".git"))) {
            return HealthStatus.degraded("git",
                    workspace + " is not a git repository", Map.of("version", version));
        }
        return HealthStatus.up("git", version, Map.of("workspace", workspace.toString()));
    }

    HealthStatus checkAgent() {
        String command = properties.getAgent().getCommand();
        Path resolved = resolveExecutable(command);
        if (resolved == null) {
            return HealthStatus.down("agent", "Agent command '" + command + "' not found");
        }
        return HealthStatus.up("agent",
                "Agent command available at " + resolved, Map.of("agent", properties.getAgent().getName()));
    }

    HealthStatus checkTaskSource() {
        String command = properties.getTasks().getCommand();
        Path resolved = resolveExecutable(command);
        if (resolved == null) {
            return HealthStatus.down("tasks", "Task tracker '" + command + "' not found");
        }
        return HealthStatus.up("tasks", "Task tracker available at " + resolved);
    }

    HealthStatus checkStateStore() {
        if (stateStore == null) {
            return HealthStatus.degraded("state-store",
                    "No iteration state store configured; checkpoints disabled", Map.of());
        }
        if (stateStore instanceof FileIterationStateStore fileStore) {
            Path dir = fileStore.getStoreDir();
            Path existing = dir;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing == null || !Files.isWritable(existing)) {
                return HealthStatus.down("state-store", "State directory " + dir + " is not writable");
            }
            return HealthStatus.up("state-store",
                    stateStore.count() + " saved iterations in " + dir, Map.of("path", dir.toString()));
        }
        return HealthStatus.up("state-store",
                stateStore.getClass().getSimpleName() + " (" + stateStore.count() + " saved iterations)");
    }

    /**
     * Runs a command and returns its first output line, or null if it could not run or failed.
     */
    String probe(List<String> command, Path workingDirectory) {
        try {
            var process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
            String firstLine;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                firstLine = reader.readLine();
            }
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return null;
            }
            return process.exitValue() == 0 ? (firstLine != null ? firstLine.trim() : "") : null;
        } catch (IOException e) {
            log.warn("Health probe '{}' failed: {}", String.join(" ", command), e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    Path resolveExecutable(String command) {
        if (command == null || command.isBlank()) {
            return null;
        }
        if (command.contains("/")) {
            Path direct = Path.of(command);
            return Files.isExecutable(direct) ? direct : null;
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return null;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, command);
            if (Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
