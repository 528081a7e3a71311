package com.crewloop.config;

import com.crewloop.core.agent.AgentControllerFactory;
import com.crewloop.core.agent.AgentProcessOptions;
import com.crewloop.core.agent.ProcessAgentController;
import com.crewloop.core.events.EventBus;
import com.crewloop.core.metrics.CrewloopMetrics;
import com.crewloop.core.persistence.EventLogPersister;
import com.crewloop.core.persistence.IterationStateStore;
import com.crewloop.core.registry.InstanceRegistry;
import com.crewloop.core.tasks.BeadsTaskSource;
import com.crewloop.core.tasks.TaskSource;
import com.crewloop.core.worker.CommandTestRunner;
import com.crewloop.core.worker.MergeConflictHandler;
import com.crewloop.core.worker.RegistryAgentRunner;
import com.crewloop.core.worker.TestRunner;
import com.crewloop.core.worker.WorkerLoop;
import com.crewloop.core.worker.WorkerLoopFactory;
import com.crewloop.core.worker.WorkerOrchestrator;
import com.crewloop.core.workspace.GitWorktreeManager;
import com.crewloop.core.workspace.WorkspaceManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine: workspace, task source, agent controllers, registry and the worker pool.
 */
@Configuration
public class CrewloopConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService registryExecutor() {
        return Executors.newFixedThreadPool(2, daemonThreads("registry"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService orchestratorScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("orchestrator"));
    }

    @Bean
    public WorkspaceManager workspaceManager(CrewloopProperties properties,
                                             @Autowired(required = false) CrewloopMetrics metrics) {
        return new GitWorktreeManager(properties.getWorkspacePath(),
                properties.getWorkspace().getMainBranch(), metrics);
    }

    @Bean
    public TaskSource taskSource(CrewloopProperties properties, ObjectMapper objectMapper) {
        String assignee = properties.getTasks().getAssignee();
        return new BeadsTaskSource(properties.getTasks().getCommand(), properties.getWorkspacePath(),
                assignee == null || assignee.isBlank() ? null : assignee, objectMapper);
    }

    @Bean
    public AgentControllerFactory agentControllerFactory(CrewloopProperties properties, ObjectMapper objectMapper) {
        var agent = properties.getAgent();
        var base = new AgentProcessOptions(agent.getCommand(), agent.getArgs(), properties.getWorkspacePath(),
                agent.getEnv(), agent.getName(), false, null);
        return workingDirectory -> new ProcessAgentController(base.withCwd(workingDirectory), objectMapper);
    }

    @Bean(destroyMethod = "disposeAll")
    public InstanceRegistry instanceRegistry(AgentControllerFactory agentControllerFactory,
                                             EventBus eventBus,
                                             IterationStateStore stateStore,
                                             @Autowired(required = false) EventLogPersister eventLog,
                                             @Autowired(required = false) CrewloopMetrics metrics,
                                             @Qualifier("registryExecutor") ExecutorService registryExecutor,
                                             CrewloopProperties properties) {
        return new InstanceRegistry(agentControllerFactory, eventBus, stateStore, eventLog, metrics,
                registryExecutor, properties.getWorkspacePath(), properties.getRegistry().getMaxInstances(),
                properties.getStopTimeout(), Clock.systemUTC());
    }

    @Bean
    public RegistryAgentRunner registryAgentRunner(InstanceRegistry instanceRegistry, CrewloopProperties properties) {
        return new RegistryAgentRunner(instanceRegistry, properties.getStopTimeout());
    }

    @Bean
    public WorkerLoopFactory workerLoopFactory(TaskSource taskSource,
                                               WorkspaceManager workspaceManager,
                                               RegistryAgentRunner agentRunner,
                                               @Autowired(required = false) MergeConflictHandler conflictHandler,
                                               @Autowired(required = false) CrewloopMetrics metrics,
                                               CrewloopProperties properties) {
        TestRunner testRunner = properties.hasTestCommand()
                ? new CommandTestRunner(properties.getWorker().getTestCommand(), properties.getWorkspacePath())
                : null;
        return workerName -> new WorkerLoop(workerName, taskSource, workspaceManager, agentRunner,
                testRunner, conflictHandler, metrics, properties.getPauseCheckInterval(),
                properties.getWorker().getMaxAttemptsPerTask(), Clock.systemUTC());
    }

    @Bean
    public WorkerOrchestrator workerOrchestrator(WorkerLoopFactory workerLoopFactory,
                                                 TaskSource taskSource,
                                                 @Qualifier("orchestratorScheduler") ScheduledExecutorService scheduler,
                                                 @Qualifier("workerExecutor") ExecutorService workerExecutor,
                                                 CrewloopProperties properties) {
        return new WorkerOrchestrator(workerLoopFactory, taskSource, properties.getWorker().getMaxWorkers(),
                properties.getPollingInterval(), scheduler, workerExecutor);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
