package com.crewloop.core.tasks;

import com.crewloop.core.model.ReadyTask;

import java.util.Optional;

/**
 * Supplies work to the worker loops.
 * <p>
 * Claiming must be atomic across workers: once {@link #claimTask(String)} returns for a task,
 * no other worker may successfully claim it.
 */
public interface TaskSource {

    Optional<ReadyTask> getReadyTask();

    /**
     * @throws TaskSourceException if the task could not be claimed
     */
    void claimTask(String taskId);

    void closeTask(String taskId);

    /**
     * Number of tasks currently ready. Used to size the worker pool.
     */
    default int countReadyTasks() {
        return getReadyTask().isPresent() ? 1 : 0;
    }
}
