package com.crewloop.core.worker;

import java.nio.file.Path;

/**
 * One agent run inside a task's worktree.
 *
 * @param attempt 1 for the first run of a task, incremented on every retry
 */
public record AgentRunRequest(
    String workerName,
    String taskId,
    String taskTitle,
    Path worktreePath,
    String branch,
    int attempt
) {}
