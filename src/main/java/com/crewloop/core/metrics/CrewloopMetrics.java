package com.crewloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for worker loops and the instance registry.
 */
@Service
public class CrewloopMetrics {

    private final MeterRegistry registry;

    public CrewloopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String workerName, String outcome) {
        Counter.builder("crewloop.tasks.total")
                .tag("worker", workerName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAgentRun(String workerName, int exitCode, long ms) {
        Timer.builder("crewloop.agent.duration")
                .tag("worker", workerName)
                .tag("exit", exitCode == 0 ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how many agent runs a task needed before it was closed.
     *
     * @param attempts number of agent runs for the task
     */
    public void recordAttemptsPerTask(int attempts) {
        DistributionSummary.builder("crewloop.tasks.attempts")
                .description("Agent runs needed per closed task")
                .register(registry)
                .record(attempts);
    }

    /**
     * Records a merge conflict and how the loop reacted to it.
     *
     * @param resolution "resolved" (retry) or "abort"
     */
    public void recordMergeConflict(String resolution) {
        Counter.builder("crewloop.merge.conflicts")
                .description("Merge conflicts during integration into the trunk")
                .tag("resolution", resolution)
                .register(registry)
                .increment();
    }

    public void recordTestRun(boolean success) {
        Counter.builder("crewloop.tests.runs")
                .tag("result", success ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * Records worktree lifecycle operations.
     *
     * @param operation "create", "merge" or "remove"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("crewloop.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordIterationSave(boolean success) {
        Counter.builder("crewloop.registry.saves")
                .tag("result", success ? "saved" : "failed")
                .register(registry)
                .increment();
    }

    public void recordEviction(String reason) {
        Counter.builder("crewloop.registry.evictions")
                .description("Instances disposed to stay under the instance cap")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordActiveInstances(int count) {
        DistributionSummary.builder("crewloop.registry.active_instances")
                .register(registry)
                .record(count);
    }
}
