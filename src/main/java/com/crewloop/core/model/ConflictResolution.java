package com.crewloop.core.model;

/**
 * Answer of a merge conflict handler.
 */
public enum ConflictResolution {
    /** Abort the merge and rerun the agent in the same worktree. */
    RESOLVED,
    /** Abort the merge and give up on the task. */
    ABORT
}
