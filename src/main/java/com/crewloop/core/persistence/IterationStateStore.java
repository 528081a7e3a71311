package com.crewloop.core.persistence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for {@link IterationState} checkpoints.
 * <p>
 * Implementations stamp {@code savedAt} and {@code version} on every save and treat
 * unreadable or unknown-version entries as absent.
 */
public interface IterationStateStore {

    Duration DEFAULT_STALE_THRESHOLD = Duration.ofHours(1);

    void save(IterationState state);

    Optional<IterationState> load(String instanceId);

    /**
     * @return true if a state was deleted, false if none existed
     */
    boolean delete(String instanceId);

    List<IterationState> getAll();

    List<String> getAllInstanceIds();

    default int count() {
        return getAllInstanceIds().size();
    }

    /**
     * Removes every state saved longer ago than {@code threshold}.
     *
     * @return number of states removed
     */
    int cleanupStale(Duration threshold);

    void clear();
}
