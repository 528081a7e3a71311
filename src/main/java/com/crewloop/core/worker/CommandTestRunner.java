package com.crewloop.core.worker;

import com.crewloop.core.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a shell command in the main workspace; exit code 0 means the tests passed.
 */
public class CommandTestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandTestRunner.class);

    private final String command;
    private final Path workspacePath;

    public CommandTestRunner(String command, Path workspacePath) {
        this.command = command;
        this.workspacePath = workspacePath;
    }

    @Override
    public TestResult runTests() {
        log.info("Running tests: {}", command);
        try {
            var process = new ProcessBuilder(shellCommand())
                    .directory(workspacePath.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode == 0) {
                return TestResult.passed(output);
            }
            log.warn("Test command exited with code {}", exitCode);
            return TestResult.failed(output);
        } catch (IOException e) {
            log.error("Test command failed to start: {}", command, e);
            return TestResult.failed("Failed to run '" + command + "': " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TestResult.failed("Interrupted while running '" + command + "'");
        }
    }

    List<String> shellCommand() {
        return List.of("/bin/sh", "-c", command);
    }
}
