package com.crewloop.core.tasks;

import com.crewloop.core.model.ReadyTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link TaskSource} over the beads ({@code bd}) issue tracker CLI.
 *
 * <p>Ready issues come from {@code bd list --json --ready}. Claiming sets the issue to
 * {@code in_progress} and assigns it; closing runs {@code bd close}.
 * Tasks claimed through this instance are hidden from {@link #getReadyTask()} until closed,
 * so workers in the same process never pick the same issue.
 */
public class BeadsTaskSource implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(BeadsTaskSource.class);

    private final String command;
    private final Path workspacePath;
    private final String assignee;
    private final ObjectMapper objectMapper;
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public BeadsTaskSource(String command, Path workspacePath, String assignee, ObjectMapper objectMapper) {
        this.command = command;
        this.workspacePath = workspacePath;
        this.assignee = assignee;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ReadyTask> getReadyTask() {
        return listReady().stream()
                .filter(task -> !claimed.contains(task.id()))
                .findFirst();
    }

    @Override
    public int countReadyTasks() {
        return (int) listReady().stream()
                .filter(task -> !claimed.contains(task.id()))
                .count();
    }

    @Override
    public void claimTask(String taskId) {
        if (!claimed.add(taskId)) {
            throw new TaskSourceException("Task " + taskId + " is already claimed");
        }
        try {
            var args = new ArrayList<>(List.of("update", "--json", taskId, "--status", "in_progress"));
            if (assignee != null && !assignee.isBlank()) {
                args.add("--assignee");
                args.add(assignee);
            }
            runBd(args.toArray(String[]::new));
            log.info("Claimed task {}", taskId);
        } catch (RuntimeException e) {
            claimed.remove(taskId);
            throw e;
        }
    }

    @Override
    public void closeTask(String taskId) {
        runBd("close", "--json", taskId);
        claimed.remove(taskId);
        log.info("Closed task {}", taskId);
    }

    List<ReadyTask> listReady() {
        String output = runBd("list", "--json", "--ready");
        if (output.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(output);
            var tasks = new ArrayList<ReadyTask>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    String id = node.path("id").asText("");
                    if (!id.isEmpty()) {
                        tasks.add(new ReadyTask(id, node.path("title").asText("")));
                    }
                }
            }
            return tasks;
        } catch (JsonProcessingException e) {
            throw new TaskSourceException("Unreadable output from bd list: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Runs the tracker CLI in the workspace and returns stdout, failing on a non-zero exit.
     */
    String runBd(String... args) {
        var cmd = new ArrayList<String>();
        cmd.add(command);
        cmd.addAll(Arrays.asList(args));
        log.debug("Running: {}", String.join(" ", cmd));

        try {
            var process = new ProcessBuilder(cmd)
                    .directory(workspacePath.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new TaskSourceException("%s %s failed with code %d: %s"
                        .formatted(command, args[0], exitCode, output.trim()));
            }
            return output;
        } catch (IOException e) {
            throw new TaskSourceException("Failed to run " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskSourceException("Interrupted while running " + command, e);
        }
    }
}
