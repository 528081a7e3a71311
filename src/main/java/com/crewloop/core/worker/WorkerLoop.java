package com.crewloop.core.worker;

import com.crewloop.core.logging.MdcContext;
import com.crewloop.core.metrics.CrewloopMetrics;
import com.crewloop.core.model.ConflictResolution;
import com.crewloop.core.model.MergeConflictContext;
import com.crewloop.core.model.MergeResult;
import com.crewloop.core.model.ReadyTask;
import com.crewloop.core.model.TestResult;
import com.crewloop.core.model.WorkerState;
import com.crewloop.core.model.WorktreeInfo;
import com.crewloop.core.tasks.TaskSource;
import com.crewloop.core.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One worker's perpetual cycle: claim a task, create its worktree, run the agent,
 * merge into the trunk, run the tests, clean up, repeat.
 *
 * <p>A claimed task is only given up when the {@link MergeConflictHandler} answers
 * {@link ConflictResolution#ABORT} or the optional attempt limit is reached. Merge conflicts,
 * failed merges and failed tests all send the worker back to rerun the agent in the same worktree.
 *
 * <p>{@link #pause()} takes effect at the next step boundary; a running agent, merge or test
 * is never interrupted. {@link #stop()} ends the loop at the next boundary and
 * {@link #forceStop()} additionally cancels the running agent. Stop always overrides pause.
 *
 * <p>{@link #runLoop()} blocks the calling thread; run each worker on its own thread.
 */
public class WorkerLoop {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    public static final Duration DEFAULT_PAUSE_CHECK_INTERVAL = Duration.ofMillis(100);

    private final String workerName;
    private final TaskSource taskSource;
    private final WorkspaceManager workspace;
    private final AgentRunner agentRunner;
    private final TestRunner testRunner;
    private final MergeConflictHandler conflictHandler;
    private final CrewloopMetrics metrics;
    private final Duration pauseCheckInterval;
    private final int maxAttemptsPerTask;
    private final Clock clock;

    private final List<Consumer<WorkerEvent>> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock pauseLock = new ReentrantLock();
    private final Condition wakeUp = pauseLock.newCondition();

    private volatile boolean stopped;
    private volatile boolean forced;
    private volatile boolean paused;
    private volatile boolean looping;
    private volatile WorkerState state = WorkerState.IDLE;
    private volatile String currentTaskId;

    public WorkerLoop(String workerName, TaskSource taskSource, WorkspaceManager workspace, AgentRunner agentRunner) {
        this(workerName, taskSource, workspace, agentRunner, null, null, null,
                DEFAULT_PAUSE_CHECK_INTERVAL, 0, Clock.systemUTC());
    }

    /**
     * @param testRunner         post-merge verification, or null to skip tests
     * @param conflictHandler    conflict policy, or null to always rerun the agent
     * @param metrics            optional metrics sink
     * @param pauseCheckInterval upper bound on how long a paused worker sleeps between checks
     * @param maxAttemptsPerTask agent runs allowed per task, 0 for no limit
     */
    public WorkerLoop(String workerName,
                      TaskSource taskSource,
                      WorkspaceManager workspace,
                      AgentRunner agentRunner,
                      TestRunner testRunner,
                      MergeConflictHandler conflictHandler,
                      CrewloopMetrics metrics,
                      Duration pauseCheckInterval,
                      int maxAttemptsPerTask,
                      Clock clock) {
        this.workerName = workerName;
        this.taskSource = taskSource;
        this.workspace = workspace;
        this.agentRunner = agentRunner;
        this.testRunner = testRunner;
        this.conflictHandler = conflictHandler;
        this.metrics = metrics;
        this.pauseCheckInterval = pauseCheckInterval;
        this.maxAttemptsPerTask = maxAttemptsPerTask;
        this.clock = clock;
    }

    // -- Loop -----------------------------------------------------------------

    /**
     * Processes tasks until the task source runs dry or the loop is stopped.
     */
    public void runLoop() {
        looping = true;
        state = paused ? WorkerState.PAUSED : WorkerState.RUNNING;
        MdcContext.setWorker(workerName);
        log.info("Worker {} started", workerName);
        try {
            while (!stopped) {
                waitWhilePaused();
                if (stopped) {
                    break;
                }
                if (!runOnce()) {
                    break;
                }
                waitWhilePaused();
            }
        } finally {
            looping = false;
            state = WorkerState.IDLE;
            log.info("Worker {} stopped", workerName);
            MdcContext.clear();
        }
    }

    /**
     * Runs one iteration.
     *
     * @return false if there was no task to work on, true if a task was attempted
     *         (whether or not it was completed)
     */
    public boolean runOnce() {
        Optional<ReadyTask> next;
        try {
            next = taskSource.getReadyTask();
        } catch (RuntimeException e) {
            log.warn("Worker {} could not fetch a ready task: {}", workerName, e.getMessage());
            emitError(null, e);
            return false;
        }
        if (next.isEmpty()) {
            emit(WorkerEvent.IDLE, null, Map.of());
            return false;
        }

        ReadyTask task = next.get();
        String taskId = task.id();
        currentTaskId = taskId;
        MdcContext.setTask(workerName, taskId);
        try {
            emit(WorkerEvent.TASK_STARTED, taskId, dataOf("taskTitle", task.title()));
            taskSource.claimTask(taskId);

            workspace.pullLatest();
            WorktreeInfo worktree = workspace.create(workerName, taskId);
            emit(WorkerEvent.WORKTREE_CREATED, taskId, Map.of("worktreePath", worktree.path().toString()));

            int attempts = runUntilIntegrated(task, worktree);
            if (attempts == 0) {
                log.info("Worker {} stopped before task {} was integrated", workerName, taskId);
                return true;
            }

            taskSource.closeTask(taskId);
            recordTaskResult("completed");
            if (metrics != null) {
                metrics.recordAttemptsPerTask(attempts);
            }
            log.info("Task {} completed after {} agent run(s)", taskId, attempts);
            emit(WorkerEvent.TASK_COMPLETED, taskId, Map.of("attempts", attempts));
        } catch (RuntimeException e) {
            log.warn("Task {} failed on worker {}: {}", taskId, workerName, e.getMessage());
            recordTaskResult(e instanceof MergeConflictException ? "aborted" : "failed");
            emitError(taskId, e);
        } finally {
            currentTaskId = null;
            MdcContext.clearTask();
        }
        return true;
    }

    /**
     * Reruns the agent until its branch merges cleanly and the tests pass.
     *
     * @return the number of agent runs it took, or 0 if the loop was stopped first
     */
    private int runUntilIntegrated(ReadyTask task, WorktreeInfo worktree) {
        String taskId = task.id();
        int attempt = 0;

        while (!stopped) {
            waitWhilePaused();
            if (stopped) {
                break;
            }
            attempt++;
            if (maxAttemptsPerTask > 0 && attempt > maxAttemptsPerTask) {
                throw new RetryLimitExceededException(taskId, maxAttemptsPerTask);
            }

            emit(WorkerEvent.AGENT_STARTED, taskId, Map.of("attempt", attempt));
            long startedAt = clock.millis();
            AgentRunResult result = agentRunner.run(new AgentRunRequest(
                    workerName, taskId, task.title(), worktree.path(), worktree.branch(), attempt));
            if (metrics != null) {
                metrics.recordAgentRun(workerName, result.exitCode(), clock.millis() - startedAt);
            }
            var completed = new HashMap<String, Object>();
            completed.put("exitCode", result.exitCode());
            completed.put("sessionId", result.sessionId());
            completed.put("attempt", attempt);
            emit(WorkerEvent.AGENT_COMPLETED, taskId, completed);

            if (result.exitCode() != 0) {
                emitError(taskId, new WorkerLoopException("Agent exited with code " + result.exitCode()));
            }
            if (forced) {
                break;
            }

            waitWhilePaused();
            MergeResult merge = workspace.merge(workerName, taskId);
            if (merge.hadConflicts()) {
                handleConflict(taskId, worktree);
                continue;
            }
            if (!merge.success()) {
                emitError(taskId, new WorkerLoopException(merge.message()));
                continue;
            }
            emit(WorkerEvent.MERGE_COMPLETED, taskId, Map.of());

            if (testRunner != null) {
                waitWhilePaused();
                TestResult tests = testRunner.runTests();
                if (metrics != null) {
                    metrics.recordTestRun(tests.success());
                }
                if (!tests.success()) {
                    log.warn("Tests failed after merging task {}", taskId);
                    var failed = new HashMap<String, Object>();
                    failed.put("success", false);
                    failed.put("output", tests.output());
                    emit(WorkerEvent.TESTS_FAILED, taskId, failed);
                    continue;
                }
            }

            workspace.remove(workerName, taskId);
            return attempt;
        }
        return 0;
    }

    private void handleConflict(String taskId, WorktreeInfo worktree) {
        ConflictResolution resolution = ConflictResolution.RESOLVED;
        List<String> files = List.of();
        try {
            files = workspace.getConflictingFiles();
            var data = new HashMap<String, Object>();
            data.put("hadConflicts", true);
            data.put("conflictingFiles", files);
            emit(WorkerEvent.MERGE_CONFLICT, taskId, data);

            if (conflictHandler != null) {
                ConflictResolution answer = conflictHandler.onMergeConflict(
                        new MergeConflictContext(taskId, workerName, worktree.path(), files));
                if (answer != null) {
                    resolution = answer;
                }
            }
        } finally {
            workspace.abortMerge();
        }

        if (metrics != null) {
            metrics.recordMergeConflict(resolution.name().toLowerCase());
        }
        if (resolution == ConflictResolution.ABORT) {
            throw new MergeConflictException("Merge conflict could not be resolved", files);
        }
        log.info("Merge conflict on task {} in {} file(s), rerunning agent", taskId, files.size());
    }

    // -- Control --------------------------------------------------------------

    /**
     * Ends the loop at the next step boundary.
     */
    public void stop() {
        stopped = true;
        signalWaiters();
    }

    /**
     * Ends the loop and cancels the agent run in progress.
     */
    public void forceStop() {
        forced = true;
        stop();
        agentRunner.cancel(workerName);
    }

    public void pause() {
        pauseLock.lock();
        try {
            if (paused) {
                return;
            }
            paused = true;
            state = WorkerState.PAUSED;
        } finally {
            pauseLock.unlock();
        }
        emit(WorkerEvent.PAUSED, currentTaskId, Map.of());
    }

    public void resume() {
        pauseLock.lock();
        try {
            if (!paused) {
                return;
            }
            paused = false;
            state = looping ? WorkerState.RUNNING : WorkerState.IDLE;
            wakeUp.signalAll();
        } finally {
            pauseLock.unlock();
        }
        emit(WorkerEvent.RESUMED, currentTaskId, Map.of());
    }

    private void waitWhilePaused() {
        pauseLock.lock();
        try {
            while (paused && !stopped) {
                wakeUp.await(pauseCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = true;
        } finally {
            pauseLock.unlock();
        }
    }

    private void signalWaiters() {
        pauseLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    // -- Accessors ------------------------------------------------------------

    public String getWorkerName() {
        return workerName;
    }

    public WorkerState getState() {
        return state;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * @return the task being worked on, or null between tasks
     */
    public String getCurrentTaskId() {
        return currentTaskId;
    }

    // -- Events ---------------------------------------------------------------

    public void addListener(Consumer<WorkerEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<WorkerEvent> listener) {
        listeners.remove(listener);
    }

    private void emitError(String taskId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        emit(new WorkerEvent(WorkerEvent.ERROR, workerName, taskId, Map.of("message", message), error, clock.instant()));
    }

    private void emit(String type, String taskId, Map<String, Object> data) {
        emit(new WorkerEvent(type, workerName, taskId, data, null, clock.instant()));
    }

    private void emit(WorkerEvent event) {
        for (Consumer<WorkerEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Worker listener threw on {}: {}", event.type(), e.getMessage(), e);
            }
        }
    }

    private void recordTaskResult(String outcome) {
        if (metrics != null) {
            metrics.recordTaskResult(workerName, outcome);
        }
    }

    private static Map<String, Object> dataOf(String key, Object value) {
        var data = new HashMap<String, Object>();
        data.put(key, value);
        return data;
    }
}
