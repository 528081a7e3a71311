package com.crewloop.core.model;

/**
 * Lifecycle state of a single worker loop.
 */
public enum WorkerState {
    IDLE,
    RUNNING,
    PAUSED
}
