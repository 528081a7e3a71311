package com.crewloop.core.worker;

import com.crewloop.core.model.WorkerState;
import com.crewloop.core.tasks.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps a pool of {@link WorkerLoop}s sized to the ready work.
 *
 * <p>Each poll starts {@code min(readyTasks, maxWorkers) - activeWorkers} new workers. A worker
 * leaves the pool when its loop returns, either because the task source ran dry or because it
 * was stopped.
 */
public class WorkerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkerOrchestrator.class);

    static final List<String> WORKER_NAMES = List.of(
            "homer", "marge", "bart", "lisa", "maggie",
            "ned", "moe", "apu", "barney", "milhouse");

    public enum State { STOPPED, RUNNING, STOPPING }

    private final WorkerLoopFactory loopFactory;
    private final TaskSource taskSource;
    private volatile int maxWorkers;
    private final Duration pollingInterval;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workerExecutor;
    private final Clock clock;

    private final Map<String, WorkerLoop> workers = new LinkedHashMap<>();
    private final List<Consumer<OrchestratorEvent>> listeners = new CopyOnWriteArrayList<>();

    private State state = State.STOPPED;
    private ScheduledFuture<?> pollTask;
    private CompletableFuture<Void> stoppedFuture = CompletableFuture.completedFuture(null);
    private boolean exitWhenIdle;

    public WorkerOrchestrator(WorkerLoopFactory loopFactory,
                              TaskSource taskSource,
                              int maxWorkers,
                              Duration pollingInterval,
                              ScheduledExecutorService scheduler,
                              ExecutorService workerExecutor) {
        this(loopFactory, taskSource, maxWorkers, pollingInterval, scheduler, workerExecutor, Clock.systemUTC());
    }

    public WorkerOrchestrator(WorkerLoopFactory loopFactory,
                              TaskSource taskSource,
                              int maxWorkers,
                              Duration pollingInterval,
                              ScheduledExecutorService scheduler,
                              ExecutorService workerExecutor,
                              Clock clock) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        this.loopFactory = loopFactory;
        this.taskSource = taskSource;
        this.maxWorkers = maxWorkers;
        this.pollingInterval = pollingInterval;
        this.scheduler = scheduler;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    public void setMaxWorkers(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        this.maxWorkers = maxWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * When set, the orchestrator stops by itself once no task is ready and no worker is active.
     */
    public void setExitWhenIdle(boolean exitWhenIdle) {
        this.exitWhenIdle = exitWhenIdle;
    }

    // -- Lifecycle ------------------------------------------------------------

    public synchronized void start() {
        if (state != State.STOPPED) {
            log.debug("Orchestrator already {}", state);
            return;
        }
        stoppedFuture = new CompletableFuture<>();
        transitionTo(State.RUNNING);
        log.info("Orchestrator started (max {} workers, polling every {} ms)", maxWorkers, pollingInterval.toMillis());
        poll();
        if (state == State.RUNNING) {
            long period = pollingInterval.toMillis();
            pollTask = scheduler.scheduleWithFixedDelay(this::pollSafely, period, period, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Checks the task source and starts workers for the ready tasks.
     */
    public synchronized void poll() {
        if (state != State.RUNNING) {
            return;
        }
        int ready;
        try {
            ready = taskSource.countReadyTasks();
        } catch (RuntimeException e) {
            log.error("Failed to count ready tasks", e);
            emit(OrchestratorEvent.ERROR, null, Map.of("message", messageOf(e)));
            return;
        }

        int wanted = Math.min(ready, maxWorkers) - workers.size();
        for (int i = 0; i < wanted; i++) {
            spawnWorker();
        }

        if (exitWhenIdle && ready == 0 && workers.isEmpty()) {
            log.info("No ready tasks and no active workers, stopping");
            cancelPolling();
            transitionTo(State.STOPPED);
        }
    }

    /**
     * Force-stops every worker, cancelling agent runs in progress.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        log.info("Stopping orchestrator and {} workers", workers.size());
        cancelPolling();
        transitionTo(State.STOPPING);
        List.copyOf(workers.values()).forEach(WorkerLoop::forceStop);
        stopIfDrained();
    }

    /**
     * Lets every worker finish its current step, then stops.
     */
    public synchronized void stopAfterCurrent() {
        if (state == State.STOPPED) {
            return;
        }
        log.info("Stopping orchestrator after current work of {} workers", workers.size());
        cancelPolling();
        transitionTo(State.STOPPING);
        List.copyOf(workers.values()).forEach(WorkerLoop::stop);
        stopIfDrained();
    }

    /**
     * @return a future completed once the orchestrator reaches {@link State#STOPPED}
     */
    public synchronized CompletableFuture<Void> whenStopped() {
        return stoppedFuture;
    }

    // -- Per-worker control ---------------------------------------------------

    public boolean pauseWorker(String workerName) {
        return withWorker(workerName, WorkerLoop::pause);
    }

    public boolean resumeWorker(String workerName) {
        return withWorker(workerName, WorkerLoop::resume);
    }

    public boolean stopWorker(String workerName) {
        return withWorker(workerName, WorkerLoop::stop);
    }

    // -- Accessors ------------------------------------------------------------

    public synchronized State getState() {
        return state;
    }

    public synchronized Optional<WorkerState> getWorkerState(String workerName) {
        return Optional.ofNullable(workers.get(workerName)).map(WorkerLoop::getState);
    }

    public synchronized Map<String, WorkerState> getWorkerStates() {
        Map<String, WorkerState> states = new LinkedHashMap<>();
        workers.forEach((name, loop) -> states.put(name, loop.getState()));
        return states;
    }

    public synchronized int getActiveWorkerCount() {
        return workers.size();
    }

    public void addListener(Consumer<OrchestratorEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<OrchestratorEvent> listener) {
        listeners.remove(listener);
    }

    // -- Internals ------------------------------------------------------------

    private void spawnWorker() {
        String name = nextWorkerName();
        WorkerLoop loop = loopFactory.create(name);
        loop.addListener(this::forward);
        workers.put(name, loop);
        emit(OrchestratorEvent.WORKER_STARTED, name, Map.of());
        log.info("Starting worker {}", name);

        workerExecutor.execute(() -> {
            try {
                loop.runLoop();
            } catch (RuntimeException e) {
                log.error("Worker {} crashed", name, e);
                emit(OrchestratorEvent.ERROR, name, Map.of("message", messageOf(e)));
            } finally {
                workerExited(name, loop);
            }
        });
    }

    private synchronized void workerExited(String name, WorkerLoop loop) {
        if (!workers.remove(name, loop)) {
            return;
        }
        String reason = loop.isStopped() ? "stopped" : "completed";
        emit(OrchestratorEvent.WORKER_STOPPED, name, Map.of("reason", reason));
        if (state == State.STOPPING) {
            stopIfDrained();
        } else if (state == State.RUNNING && exitWhenIdle && workers.isEmpty()) {
            poll();
        }
    }

    private String nextWorkerName() {
        for (String candidate : WORKER_NAMES) {
            if (!workers.containsKey(candidate)) {
                return candidate;
            }
        }
        int n = WORKER_NAMES.size() + 1;
        while (workers.containsKey("worker-" + n)) {
            n++;
        }
        return "worker-" + n;
    }

    private boolean withWorker(String workerName, Consumer<WorkerLoop> action) {
        WorkerLoop loop;
        synchronized (this) {
            loop = workers.get(workerName);
        }
        if (loop == null) {
            return false;
        }
        action.accept(loop);
        return true;
    }

    private void forward(WorkerEvent event) {
        Map<String, Object> data = new HashMap<>(event.data());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        switch (event.type()) {
            case WorkerEvent.TASK_STARTED -> emit(OrchestratorEvent.TASK_STARTED, event.workerName(), data);
            case WorkerEvent.TASK_COMPLETED -> emit(OrchestratorEvent.TASK_COMPLETED, event.workerName(), data);
            case WorkerEvent.PAUSED -> emit(OrchestratorEvent.WORKER_PAUSED, event.workerName(), data);
            case WorkerEvent.RESUMED -> emit(OrchestratorEvent.WORKER_RESUMED, event.workerName(), data);
            case WorkerEvent.ERROR -> {
                if (event.error() != null) {
                    data.put("message", messageOf(event.error()));
                }
                emit(OrchestratorEvent.ERROR, event.workerName(), data);
            }
            default -> {
                // worker-internal step
            }
        }
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Orchestrator poll failed", e);
        }
    }

    private void cancelPolling() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
    }

    private void stopIfDrained() {
        if (workers.isEmpty()) {
            transitionTo(State.STOPPED);
        }
    }

    private void transitionTo(State next) {
        if (state == next) {
            return;
        }
        State previous = state;
        state = next;
        emit(OrchestratorEvent.STATE_CHANGED, null, Map.of("from", previous.name(), "to", next.name()));
        if (next == State.STOPPED) {
            log.info("Orchestrator stopped");
            stoppedFuture.complete(null);
        }
    }

    private void emit(String type, String workerName, Map<String, Object> data) {
        var event = new OrchestratorEvent(type, workerName, Collections.unmodifiableMap(new HashMap<>(data)), clock.instant());
        for (Consumer<OrchestratorEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Orchestrator listener threw: {}", e.getMessage(), e);
            }
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }
}
