package com.crewloop.core.worker;

/**
 * Runs the coding agent for one attempt at a task and waits for it to finish.
 */
@FunctionalInterface
public interface AgentRunner {

    AgentRunResult run(AgentRunRequest request);

    /**
     * Terminates the run in progress for the worker, if any.
     */
    default void cancel(String workerName) {}
}
