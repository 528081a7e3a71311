package com.crewloop.core.worker;

import com.crewloop.core.model.ExitInfo;
import com.crewloop.core.registry.CreateInstanceOptions;
import com.crewloop.core.registry.InstanceRegistry;
import com.crewloop.core.registry.InstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * {@link AgentRunner} that runs each attempt as a registry instance, so every run gets event
 * forwarding, history and checkpoints. The instance is disposed once the agent exits, and
 * {@link #run} returns only after its final checkpoint is written; the checkpoint is kept.
 */
public class RegistryAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(RegistryAgentRunner.class);

    private final InstanceRegistry registry;
    private final Duration stopTimeout;
    private final ConcurrentHashMap<String, InstanceState> running = new ConcurrentHashMap<>();

    public RegistryAgentRunner(InstanceRegistry registry, Duration stopTimeout) {
        this.registry = registry;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public AgentRunResult run(AgentRunRequest request) {
        String instanceId = instanceId(request);
        InstanceState instance = registry.create(new CreateInstanceOptions(
                instanceId, request.taskTitle(), request.workerName(), request.worktreePath(), request.branch()));
        running.put(request.workerName(), instance);
        try {
            ExitInfo exit = instance.getController().start().get();
            int exitCode = exit.code() != null ? exit.code() : -1;
            String sessionId = registry.getSessionId(instanceId).orElse(null);
            log.info("Agent for {} exited with code {}", instanceId, exitCode);
            return new AgentRunResult(exitCode, sessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            instance.getController().stop(stopTimeout);
            throw new WorkerLoopException("Interrupted while waiting for agent " + instanceId, e);
        } catch (ExecutionException e) {
            throw new WorkerLoopException("Agent " + instanceId + " failed", e.getCause());
        } finally {
            running.remove(request.workerName(), instance);
            registry.dispose(instanceId).join();
        }
    }

    @Override
    public void cancel(String workerName) {
        InstanceState instance = running.get(workerName);
        if (instance != null) {
            log.info("Cancelling agent {} of worker {}", instance.getId(), workerName);
            instance.getController().stop(stopTimeout);
        }
    }

    static String instanceId(AgentRunRequest request) {
        return request.workerName() + "-" + request.taskId() + "-" + request.attempt();
    }
}
