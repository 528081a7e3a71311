package com.crewloop.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * What a merge conflict handler gets to see.
 */
public record MergeConflictContext(
    String taskId,
    String workerName,
    Path worktreePath,
    List<String> conflictingFiles
) {}
