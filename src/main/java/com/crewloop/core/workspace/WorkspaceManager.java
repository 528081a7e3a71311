package com.crewloop.core.workspace;

import com.crewloop.core.model.MergeResult;
import com.crewloop.core.model.WorktreeInfo;

import java.util.List;

/**
 * Materializes isolated worktrees per (worker, task) and folds their branches back into the trunk.
 * <p>
 * Implementations are shared by all workers and must serialize operations on the trunk.
 */
public interface WorkspaceManager {

    /**
     * Brings the trunk up to date with shared history. Best effort.
     */
    void pullLatest();

    WorktreeInfo create(String workerName, String taskId);

    /**
     * Merges the worker's task branch into the trunk. Failures are reported in the result,
     * not thrown. A result with {@code hadConflicts} leaves the merge in progress until
     * {@link #abortMerge()} is called.
     */
    MergeResult merge(String workerName, String taskId);

    List<String> getConflictingFiles();

    void abortMerge();

    void remove(String workerName, String taskId);
}
