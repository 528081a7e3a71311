package com.crewloop.core.registry;

import com.crewloop.core.agent.AgentControllerFactory;
import com.crewloop.core.agent.AgentListener;
import com.crewloop.core.agent.AgentProcessController;
import com.crewloop.core.conversation.ConversationContext;
import com.crewloop.core.conversation.ConversationReconstructor;
import com.crewloop.core.events.EventBus;
import com.crewloop.core.events.InstanceEvent;
import com.crewloop.core.logging.MdcContext;
import com.crewloop.core.metrics.CrewloopMetrics;
import com.crewloop.core.model.AgentEvent;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;
import com.crewloop.core.model.MergeConflict;
import com.crewloop.core.persistence.EventLogPersister;
import com.crewloop.core.persistence.IterationState;
import com.crewloop.core.persistence.IterationStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the set of live agent instances.
 *
 * <p>For every instance the registry
 * <ul>
 *   <li>forwards the controller's notifications onto the {@link EventBus}, tagged with the instance id</li>
 *   <li>keeps the last {@value #MAX_EVENT_HISTORY} events and tracks the task in progress</li>
 *   <li>checkpoints an {@link IterationState} at turn and task boundaries, on pause, on error and on exit</li>
 * </ul>
 * and keeps the number of instances at or below {@code maxInstances} by evicting the oldest
 * stopped instance, or the oldest one if none is stopped.
 *
 * <p>Controllers call back on their own reader threads. Each instance's history is guarded by
 * its own monitor, and saves for one instance are chained so they never overlap.
 */
public class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    public static final int MAX_EVENT_HISTORY = 1000;
    public static final int DEFAULT_MAX_INSTANCES = 10;

    private static final Set<String> AUTO_SAVE_EVENTS =
            Set.of(AgentEvent.RESULT, AgentEvent.TASK_COMPLETED, AgentEvent.MESSAGE_STOP);

    private final AgentControllerFactory controllerFactory;
    private final EventBus eventBus;
    private final IterationStateStore stateStore;
    private final EventLogPersister eventLog;
    private final CrewloopMetrics metrics;
    private final Executor executor;
    private final Path defaultWorkingDirectory;
    private final int maxInstances;
    private final Duration stopTimeout;
    private final Clock clock;

    private final Object createLock = new Object();
    private final Object evictionLock = new Object();
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentHashMap<String, InstanceState> instances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, EventHistory> histories = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Void>> pendingSaves = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Void>> disposals = new ConcurrentHashMap<>();
    private final Set<String> evicting = ConcurrentHashMap.newKeySet();

    /**
     * @param controllerFactory       builds a controller for each new instance
     * @param eventBus                receives the instance-tagged stream
     * @param stateStore              checkpoint store, or null to disable checkpoints
     * @param eventLog                event log, or null to keep history in memory only
     * @param metrics                 optional metrics sink
     * @param executor                runs saves and evictions
     * @param defaultWorkingDirectory working directory for instances without a worktree
     * @param maxInstances            instance cap, 0 for unlimited
     * @param stopTimeout             grace period before an agent is killed on dispose
     * @param clock                   time source for timestamps
     */
    public InstanceRegistry(AgentControllerFactory controllerFactory,
                            EventBus eventBus,
                            IterationStateStore stateStore,
                            EventLogPersister eventLog,
                            CrewloopMetrics metrics,
                            Executor executor,
                            Path defaultWorkingDirectory,
                            int maxInstances,
                            Duration stopTimeout,
                            Clock clock) {
        this.controllerFactory = controllerFactory;
        this.eventBus = eventBus;
        this.stateStore = stateStore;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.executor = executor;
        this.defaultWorkingDirectory = defaultWorkingDirectory;
        this.maxInstances = maxInstances;
        this.stopTimeout = stopTimeout;
        this.clock = clock;
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Creates and registers an instance, then evicts older instances if the cap is exceeded.
     *
     * @throws IllegalStateException if an instance with the same id already exists
     */
    public InstanceState create(CreateInstanceOptions options) {
        String id = options.id();
        InstanceState state;
        synchronized (createLock) {
            if (instances.containsKey(id)) {
                throw new IllegalStateException("Instance with ID '" + id + "' already exists");
            }
            Path cwd = options.worktreePath() != null ? options.worktreePath() : defaultWorkingDirectory;
            AgentProcessController controller = controllerFactory.create(cwd);
            state = new InstanceState(options, controller, clock.millis(), sequence.incrementAndGet());
            histories.put(id, new EventHistory());
            controller.addListener(new Forwarder(state));
            instances.put(id, state);
        }

        log.info("Created instance {} in {}", id,
                options.worktreePath() != null ? options.worktreePath() : defaultWorkingDirectory);
        var payload = new HashMap<String, Object>();
        payload.put("name", options.name());
        payload.put("agentName", options.agentName());
        payload.put("worktreePath", options.worktreePath() != null ? options.worktreePath().toString() : null);
        payload.put("branch", options.branch());
        eventBus.publish(InstanceEvent.of(InstanceEvent.INSTANCE_CREATED, id, payload));
        if (metrics != null) {
            metrics.recordActiveInstances(instances.size());
        }

        enforceMaxInstances(id);
        return state;
    }

    /**
     * Saves (if running or paused) and stops the instance, detaches its listeners and forgets it.
     * A save already pending for the instance finishes before it is forgotten.
     * Concurrent calls share one future; disposing an unknown id is a no-op.
     */
    public CompletableFuture<Void> dispose(String instanceId) {
        InstanceState state = instances.get(instanceId);
        if (state == null) {
            return CompletableFuture.completedFuture(null);
        }
        var created = new CompletableFuture<Void>();
        CompletableFuture<Void> existing = disposals.putIfAbsent(instanceId, created);
        if (existing != null) {
            return existing;
        }

        AgentProcessController controller = state.getController();
        boolean active = controller.status().isActive();

        CompletableFuture<Void> saved = active
                ? saveIterationState(instanceId)
                : pendingSave(instanceId);

        saved.thenCompose(v -> active ? stopQuietly(instanceId, controller) : CompletableFuture.<Void>completedFuture(null))
                .whenComplete((v, error) -> {
                    try {
                        controller.removeAllListeners();
                        instances.remove(instanceId);
                        histories.remove(instanceId);
                        pendingSaves.remove(instanceId);
                        log.info("Disposed instance {}", instanceId);
                        eventBus.publish(InstanceEvent.of(InstanceEvent.INSTANCE_DISPOSED, instanceId, Map.of()));
                    } finally {
                        disposals.remove(instanceId, created);
                        created.complete(null);
                    }
                });
        return created;
    }

    /**
     * Disposes every instance concurrently.
     */
    public CompletableFuture<Void> disposeAll() {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (String id : List.copyOf(instances.keySet())) {
            futures.add(dispose(id));
        }
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    }

    private CompletableFuture<Void> stopQuietly(String instanceId, AgentProcessController controller) {
        CompletableFuture<Void> stopped;
        try {
            stopped = controller.stop(stopTimeout);
        } catch (RuntimeException e) {
            log.warn("Stopping instance {} failed: {}", instanceId, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return stopped
                .orTimeout(stopTimeout.toMillis() + TimeUnit.SECONDS.toMillis(5), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    log.warn("Stopping instance {} failed: {}", instanceId, error.getMessage());
                    return null;
                });
    }

    // -- Lookups --------------------------------------------------------------

    public Optional<InstanceState> get(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    public boolean has(String instanceId) {
        return instances.containsKey(instanceId);
    }

    public List<InstanceState> getAll() {
        return new ArrayList<>(instances.values());
    }

    public List<String> getInstanceIds() {
        return new ArrayList<>(instances.keySet());
    }

    public int size() {
        return instances.size();
    }

    /**
     * @return empty if the instance does not exist, otherwise its task (possibly with null fields)
     */
    public Optional<CurrentTask> getCurrentTask(String instanceId) {
        return get(instanceId).map(InstanceState::currentTask);
    }

    /**
     * Records or clears ({@code conflict == null}) the merge conflict of an instance.
     *
     * @return false if the instance does not exist
     */
    public boolean setMergeConflict(String instanceId, MergeConflict conflict) {
        InstanceState state = instances.get(instanceId);
        if (state == null) {
            return false;
        }
        state.setMergeConflict(conflict);
        var payload = new HashMap<String, Object>();
        payload.put("conflict", conflict);
        eventBus.publish(InstanceEvent.of(InstanceEvent.INSTANCE_MERGE_CONFLICT, instanceId, payload));
        return true;
    }

    /**
     * @return empty if the instance does not exist, otherwise its conflict slot
     */
    public Optional<ConflictStatus> getMergeConflict(String instanceId) {
        return get(instanceId).map(state -> new ConflictStatus(state.getMergeConflict()));
    }

    // -- Event history --------------------------------------------------------

    public List<AgentEvent> getEventHistory(String instanceId) {
        EventHistory history = histories.get(instanceId);
        return history == null ? List.of() : history.snapshot();
    }

    /**
     * Total number of events ever appended for the instance, including trimmed ones.
     */
    public long getTotalEventCount(String instanceId) {
        EventHistory history = histories.get(instanceId);
        return history == null ? 0 : history.totalAppended();
    }

    public void clearEventHistory(String instanceId) {
        EventHistory history = histories.get(instanceId);
        if (history != null) {
            history.clear();
        }
        if (eventLog != null) {
            try {
                eventLog.clear(instanceId);
            } catch (RuntimeException e) {
                log.error("Failed to clear persisted events for {}: {}", instanceId, e.getMessage());
            }
        }
    }

    /**
     * Reloads an instance's history from the event log, e.g. after a restart.
     *
     * @return number of events restored
     */
    public int restoreEventHistory(String instanceId) {
        EventHistory history = histories.get(instanceId);
        if (history == null || eventLog == null) {
            return 0;
        }
        try {
            List<AgentEvent> events = eventLog.readEvents(instanceId);
            history.replaceWith(events);
            log.info("Restored {} events for instance {}", events.size(), instanceId);
            return events.size();
        } catch (RuntimeException e) {
            log.error("Failed to restore events for {}: {}", instanceId, e.getMessage());
            return 0;
        }
    }

    // -- Iteration state ------------------------------------------------------

    /**
     * Rebuilds the conversation from the event history and saves a checkpoint.
     * A call made while another save for the same instance is pending runs after it,
     * with the data current at that time. Failures are logged, never propagated.
     */
    public CompletableFuture<Void> saveIterationState(String instanceId) {
        InstanceState state = instances.get(instanceId);
        EventHistory history = histories.get(instanceId);
        if (stateStore == null || state == null || history == null) {
            return CompletableFuture.completedFuture(null);
        }
        var next = new CompletableFuture<Void>();
        CompletableFuture<Void> previous = pendingSaves.put(instanceId, next);
        CompletableFuture<Void> base = previous == null
                ? CompletableFuture.completedFuture(null)
                : previous.handle((v, e) -> null);

        base.thenRunAsync(() -> doSave(state, history), executor)
                .whenComplete((v, error) -> {
                    pendingSaves.remove(instanceId, next);
                    if (error != null) {
                        log.error("Failed to save iteration state for {}: {}", instanceId, error.getMessage());
                    }
                    next.complete(null);
                });
        return next;
    }

    /**
     * Saves every running or paused instance. Used on shutdown.
     */
    public CompletableFuture<Void> saveAllIterationStates() {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (InstanceState state : instances.values()) {
            if (state.getStatus().isActive()) {
                futures.add(saveIterationState(state.getId()));
            }
        }
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    }

    public Optional<IterationState> loadIterationState(String instanceId) {
        if (stateStore == null) {
            return Optional.empty();
        }
        try {
            return stateStore.load(instanceId);
        } catch (RuntimeException e) {
            log.error("Failed to load iteration state for {}: {}", instanceId, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean deleteIterationState(String instanceId) {
        if (stateStore == null) {
            return false;
        }
        try {
            return stateStore.delete(instanceId);
        } catch (RuntimeException e) {
            log.error("Failed to delete iteration state for {}: {}", instanceId, e.getMessage());
            return false;
        }
    }

    /**
     * Completes when the save pending for the instance, if any, has finished.
     */
    private CompletableFuture<Void> pendingSave(String instanceId) {
        CompletableFuture<Void> pending = pendingSaves.get(instanceId);
        return pending == null ? CompletableFuture.completedFuture(null) : pending.handle((v, e) -> null);
    }

    /**
     * Writes a checkpoint from the instance and history captured when the save was requested,
     * so a save queued just before disposal still lands.
     */
    private void doSave(InstanceState state, EventHistory history) {
        String instanceId = state.getId();
        List<AgentEvent> events = history.snapshot();
        ConversationContext context = ConversationReconstructor.reconstruct(events, clock);
        var snapshot = new IterationState(
                instanceId,
                context,
                latestSessionId(events),
                state.getStatus(),
                state.getCurrentTaskId(),
                clock.millis(),
                IterationState.CURRENT_VERSION);
        try {
            stateStore.save(snapshot);
            if (metrics != null) {
                metrics.recordIterationSave(true);
            }
        } catch (RuntimeException e) {
            log.error("Failed to save iteration state for {}: {}", instanceId, e.getMessage(), e);
            if (metrics != null) {
                metrics.recordIterationSave(false);
            }
        }
    }

    /**
     * @return the most recent session id the instance's agent reported
     */
    public Optional<String> getSessionId(String instanceId) {
        return Optional.ofNullable(latestSessionId(getEventHistory(instanceId)));
    }

    private static String latestSessionId(List<AgentEvent> events) {
        for (int i = events.size() - 1; i >= 0; i--) {
            String sessionId = events.get(i).getString("sessionId");
            if (sessionId != null && !sessionId.isEmpty()) {
                return sessionId;
            }
        }
        return null;
    }

    private void autoSave(String instanceId, String trigger) {
        saveIterationState(instanceId).whenComplete((v, error) -> {
            if (error != null) {
                log.error("Auto-save failed for {} {}: {}", instanceId, trigger, error.getMessage());
            }
        });
    }

    // -- Eviction -------------------------------------------------------------

    private void enforceMaxInstances(String protectedId) {
        if (maxInstances <= 0) {
            return;
        }
        synchronized (evictionLock) {
            while (instances.size() - evicting.size() > maxInstances) {
                Optional<InstanceState> victim = pickEvictionCandidate(protectedId);
                if (victim.isEmpty()) {
                    return;
                }
                String id = victim.get().getId();
                boolean stopped = victim.get().getStatus() == AgentStatus.STOPPED;
                evicting.add(id);
                log.info("Instance cap {} exceeded, evicting {} instance {}",
                        maxInstances, stopped ? "stopped" : "oldest", id);
                if (metrics != null) {
                    metrics.recordEviction(stopped ? "stopped" : "oldest");
                }
                CompletableFuture.runAsync(() -> { }, executor)
                        .thenCompose(v -> dispose(id))
                        .whenComplete((v, error) -> {
                            evicting.remove(id);
                            if (error != null) {
                                log.warn("Evicting instance {} failed: {}", id, error.getMessage());
                            }
                        });
            }
        }
    }

    private Optional<InstanceState> pickEvictionCandidate(String protectedId) {
        Comparator<InstanceState> oldestFirst = Comparator
                .comparingLong(InstanceState::getCreatedAt)
                .thenComparingLong(InstanceState::getSequence);
        List<InstanceState> candidates = instances.values().stream()
                .filter(s -> !s.getId().equals(protectedId))
                .filter(s -> !evicting.contains(s.getId()))
                .sorted(oldestFirst)
                .toList();
        return candidates.stream()
                .filter(s -> s.getStatus() == AgentStatus.STOPPED)
                .findFirst()
                .or(() -> candidates.stream().findFirst());
    }

    // -- Forwarding -----------------------------------------------------------

    /**
     * Relays one controller's notifications, keeping history and checkpoints up to date.
     */
    private final class Forwarder implements AgentListener {

        private final InstanceState state;
        private final String id;

        Forwarder(InstanceState state) {
            this.state = state;
            this.id = state.getId();
        }

        @Override
        public void onEvent(AgentEvent received) {
            MdcContext.setInstance(id);
            try {
                AgentEvent event = received.id() == null
                        ? received.with("id", UUID.randomUUID().toString())
                        : received;

                updateCurrentTask(event);
                EventHistory history = histories.get(id);
                if (history != null) {
                    history.append(event);
                }
                if (eventLog != null) {
                    try {
                        eventLog.append(id, event);
                    } catch (RuntimeException e) {
                        log.error("Failed to persist event for {}: {}", id, e.getMessage());
                    }
                }
                eventBus.publish(InstanceEvent.of(InstanceEvent.AGENT_EVENT, id, Map.of("event", event)));

                if (AUTO_SAVE_EVENTS.contains(event.type())) {
                    autoSave(id, "after " + event.type());
                }
            } finally {
                MdcContext.clearInstance();
            }
        }

        @Override
        public void onStatus(AgentStatus status) {
            eventBus.publish(InstanceEvent.of(InstanceEvent.AGENT_STATUS, id, Map.of("status", status.wireValue())));
            if (status == AgentStatus.PAUSED || status == AgentStatus.STOPPING_AFTER_CURRENT) {
                autoSave(id, "on status " + status.wireValue());
            }
        }

        @Override
        public void onOutput(String line) {
            eventBus.publish(InstanceEvent.of(InstanceEvent.AGENT_OUTPUT, id, Map.of("line", line)));
        }

        @Override
        public void onError(Throwable error) {
            String message = error.getMessage() != null ? error.getMessage() : error.toString();
            eventBus.publish(InstanceEvent.of(InstanceEvent.AGENT_ERROR, id, Map.of("message", message)));
            autoSave(id, "on error");
        }

        @Override
        public void onExit(ExitInfo exit) {
            var payload = new HashMap<String, Object>();
            payload.put("code", exit.code());
            payload.put("signal", exit.signal());
            saveIterationState(id).whenComplete((v, error) ->
                    eventBus.publish(InstanceEvent.of(InstanceEvent.AGENT_EXIT, id, payload)));
        }

        private void updateCurrentTask(AgentEvent event) {
            if (AgentEvent.TASK_STARTED.equals(event.type())) {
                state.setCurrentTask(new CurrentTask(event.getString("taskId"), event.getString("taskTitle")));
            } else if (AgentEvent.TASK_COMPLETED.equals(event.type())) {
                state.setCurrentTask(new CurrentTask(null, null));
            }
        }
    }

    /**
     * Bounded per-instance event buffer; the oldest events are dropped first.
     */
    private static final class EventHistory {

        private final ArrayDeque<AgentEvent> events = new ArrayDeque<>();
        private long totalAppended;

        synchronized void append(AgentEvent event) {
            events.addLast(event);
            totalAppended++;
            while (events.size() > MAX_EVENT_HISTORY) {
                events.removeFirst();
            }
        }

        synchronized List<AgentEvent> snapshot() {
            return new ArrayList<>(events);
        }

        synchronized long totalAppended() {
            return totalAppended;
        }

        synchronized void clear() {
            events.clear();
        }

        synchronized void replaceWith(List<AgentEvent> restored) {
            events.clear();
            int skip = Math.max(0, restored.size() - MAX_EVENT_HISTORY);
            events.addAll(restored.subList(skip, restored.size()));
            totalAppended = restored.size();
        }
    }
}
