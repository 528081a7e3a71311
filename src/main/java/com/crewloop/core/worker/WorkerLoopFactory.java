package com.crewloop.core.worker;

/**
 * Builds a fresh {@link WorkerLoop} for a named worker.
 */
@FunctionalInterface
public interface WorkerLoopFactory {

    WorkerLoop create(String workerName);
}
