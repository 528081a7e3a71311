package com.crewloop.core.model;

import java.nio.file.Path;

/**
 * An isolated checkout scoped to one worker and one task.
 *
 * @param path       directory of the worktree
 * @param branch     branch checked out in the worktree
 * @param workerName owning worker
 * @param taskId     task the worktree was created for
 */
public record WorktreeInfo(
    Path path,
    String branch,
    String workerName,
    String taskId
) {}
