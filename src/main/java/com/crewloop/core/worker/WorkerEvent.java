package com.crewloop.core.worker;

import java.time.Instant;
import java.util.Map;

/**
 * Notification emitted by a {@link WorkerLoop}.
 *
 * @param type       one of the constants below
 * @param workerName emitting worker
 * @param taskId     task in progress, null for worker-level events
 * @param data       event-specific fields
 * @param error      cause of an {@link #ERROR} event, null otherwise
 * @param timestamp  emission time
 */
public record WorkerEvent(
    String type,
    String workerName,
    String taskId,
    Map<String, Object> data,
    Throwable error,
    Instant timestamp
) {
    public static final String IDLE = "idle";
    public static final String TASK_STARTED = "task_started";
    public static final String WORKTREE_CREATED = "worktree_created";
    public static final String AGENT_STARTED = "agent_started";
    public static final String AGENT_COMPLETED = "agent_completed";
    public static final String MERGE_COMPLETED = "merge_completed";
    public static final String MERGE_CONFLICT = "merge_conflict";
    public static final String TESTS_FAILED = "tests_failed";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String PAUSED = "paused";
    public static final String RESUMED = "resumed";
    public static final String ERROR = "error";

    public boolean is(String eventType) {
        return type.equals(eventType);
    }
}
