package com.crewloop.core.persistence;

import com.crewloop.core.model.AgentEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes events as JSON lines to {@code <workspace>/.crewloop/events/<instanceId>.jsonl}.
 */
public class FileEventLogPersister implements EventLogPersister {

    private static final Logger log = LoggerFactory.getLogger(FileEventLogPersister.class);

    private final Path storeDir;
    private final ObjectMapper objectMapper;

    public FileEventLogPersister(Path workspacePath, ObjectMapper objectMapper) {
        this.storeDir = workspacePath.resolve(".crewloop").resolve("events");
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(String instanceId, AgentEvent event) {
        try {
            Files.createDirectories(storeDir);
            String line = objectMapper.writeValueAsString(event) + "\n";
            Files.writeString(logPath(instanceId), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append event for " + instanceId, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<AgentEvent> readEvents(String instanceId) {
        Path path = logPath(instanceId);
        var events = new ArrayList<AgentEvent>();
        if (!Files.exists(path)) {
            return events;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read events for " + instanceId, e);
        }
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(new AgentEvent(objectMapper.readValue(line, Map.class)));
            } catch (JsonProcessingException e) {
                log.warn("Skipping invalid event line for {}", instanceId);
            }
        }
        return events;
    }

    @Override
    public synchronized boolean clear(String instanceId) {
        try {
            Files.delete(logPath(instanceId));
            return true;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear events for " + instanceId, e);
        }
    }

    @Override
    public boolean has(String instanceId) {
        return Files.exists(logPath(instanceId));
    }

    private Path logPath(String instanceId) {
        return storeDir.resolve(instanceId + ".jsonl");
    }
}
