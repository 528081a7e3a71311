package com.crewloop.core.persistence;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store. State is lost when the process exits.
 */
public class InMemoryIterationStateStore implements IterationStateStore {

    private final ConcurrentHashMap<String, IterationState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIterationStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryIterationStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(IterationState state) {
        states.put(state.instanceId(), state.stamped(clock.millis()));
    }

    @Override
    public Optional<IterationState> load(String instanceId) {
        return Optional.ofNullable(states.get(instanceId));
    }

    @Override
    public boolean delete(String instanceId) {
        return states.remove(instanceId) != null;
    }

    @Override
    public List<IterationState> getAll() {
        return new ArrayList<>(states.values());
    }

    @Override
    public List<String> getAllInstanceIds() {
        var ids = new ArrayList<>(states.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    @Override
    public int cleanupStale(Duration threshold) {
        long cutoff = clock.millis() - threshold.toMillis();
        int before = states.size();
        states.values().removeIf(state -> state.savedAt() < cutoff);
        return before - states.size();
    }

    @Override
    public void clear() {
        states.clear();
    }
}
