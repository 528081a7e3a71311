package com.crewloop.core.worker;

import java.time.Instant;
import java.util.Map;

/**
 * Notification emitted by the {@link WorkerOrchestrator}.
 *
 * @param workerName worker concerned, null for orchestrator-level events
 */
public record OrchestratorEvent(
    String type,
    String workerName,
    Map<String, Object> data,
    Instant timestamp
) {
    public static final String WORKER_STARTED = "worker_started";
    public static final String WORKER_STOPPED = "worker_stopped";
    public static final String WORKER_PAUSED = "worker_paused";
    public static final String WORKER_RESUMED = "worker_resumed";
    public static final String TASK_STARTED = "task_started";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String STATE_CHANGED = "state_changed";
    public static final String ERROR = "error";

    public boolean is(String eventType) {
        return type.equals(eventType);
    }
}
