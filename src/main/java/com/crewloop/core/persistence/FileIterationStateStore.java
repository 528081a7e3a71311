package com.crewloop.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * File-backed store that keeps one pretty-printed JSON document per instance under
 * {@code <workspace>/.crewloop/iterations/<instanceId>.json}.
 * <p>
 * Writes go to a temporary sibling first and are moved into place, so a reader never
 * observes a half-written file.
 */
public class FileIterationStateStore implements IterationStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileIterationStateStore.class);

    private static final String SUFFIX = ".json";

    private final Path storeDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileIterationStateStore(Path workspacePath, ObjectMapper objectMapper) {
        this(workspacePath, objectMapper, Clock.systemUTC());
    }

    public FileIterationStateStore(Path workspacePath, ObjectMapper objectMapper, Clock clock) {
        this.storeDir = workspacePath.resolve(".crewloop").resolve("iterations");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path getStoreDir() {
        return storeDir;
    }

    public boolean has(String instanceId) {
        return Files.exists(statePath(instanceId));
    }

    @Override
    public void save(IterationState state) {
        var stamped = state.stamped(clock.millis());
        Path target = statePath(state.instanceId());
        try {
            Files.createDirectories(storeDir);
            Path tmp = storeDir.resolve(state.instanceId() + SUFFIX + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), stamped);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save iteration state for " + state.instanceId(), e);
        }
        log.debug("Saved iteration state for {} ({} messages)",
                state.instanceId(), stamped.conversationContext().messages().size());
    }

    @Override
    public Optional<IterationState> load(String instanceId) {
        Path path = statePath(instanceId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            var state = objectMapper.readValue(path.toFile(), IterationState.class);
            if (state.version() != IterationState.CURRENT_VERSION) {
                log.warn("Unknown state version {} for instance {}, ignoring", state.version(), instanceId);
                return Optional.empty();
            }
            if (state.instanceId() == null || state.instanceId().isEmpty() || state.conversationContext() == null) {
                log.warn("Malformed state for instance {}, ignoring", instanceId);
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (IOException e) {
            log.warn("Error loading state for instance {}: {}", instanceId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean delete(String instanceId) {
        try {
            Files.delete(statePath(instanceId));
            return true;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete iteration state for " + instanceId, e);
        }
    }

    @Override
    public List<IterationState> getAll() {
        var states = new ArrayList<IterationState>();
        for (String id : getAllInstanceIds()) {
            load(id).ifPresent(states::add);
        }
        return states;
    }

    @Override
    public List<String> getAllInstanceIds() {
        var ids = new ArrayList<String>();
        if (!Files.isDirectory(storeDir)) {
            return ids;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storeDir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + storeDir, e);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    @Override
    public int cleanupStale(Duration threshold) {
        long now = clock.millis();
        int removed = 0;
        for (IterationState state : getAll()) {
            long age = now - state.savedAt();
            if (age > threshold.toMillis()) {
                log.info("Removing stale state for instance {} (age: {}m)",
                        state.instanceId(), Duration.ofMillis(age).toMinutes());
                if (delete(state.instanceId())) {
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        for (String id : getAllInstanceIds()) {
            delete(id);
        }
    }

    private Path statePath(String instanceId) {
        return storeDir.resolve(instanceId + SUFFIX);
    }
}
