package com.crewloop.dispatch.cli;

import com.crewloop.core.registry.InstanceRegistry;
import com.crewloop.core.worker.OrchestratorEvent;
import com.crewloop.core.worker.WorkerOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * CLI command: crewloop run [--workers N] [--once]
 * <p>
 * Starts the worker pool and blocks until it stops. Ctrl+C saves the iteration state of running
 * agents, then stops all workers and disposes their agents.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Work through ready tasks")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--workers", "-w"}, description = "Maximum concurrent workers (default: crewloop.worker.max-workers)")
    private Integer workers;

    @Option(names = "--once", description = "Exit when no task is ready and all workers are idle")
    private boolean once;

    private final WorkerOrchestrator orchestrator;
    private final InstanceRegistry instanceRegistry;

    public RunCommand(WorkerOrchestrator orchestrator, InstanceRegistry instanceRegistry) {
        this.orchestrator = orchestrator;
        this.instanceRegistry = instanceRegistry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (workers != null) {
            if (workers < 1) {
                ConsoleOutput.error("--workers must be at least 1");
                return 2;
            }
            orchestrator.setMaxWorkers(workers);
        }
        orchestrator.setExitWhenIdle(once);

        Consumer<OrchestratorEvent> printer = ConsoleOutput::orchestratorEvent;
        orchestrator.addListener(printer);
        var shutdownHook = new Thread(this::shutdown, "crewloop-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        ConsoleOutput.info("Starting up to " + orchestrator.getMaxWorkers() + " workers"
                + (once ? " (exit when idle)" : ""));
        try {
            orchestrator.start();
            orchestrator.whenStopped().join();
        } finally {
            orchestrator.removeListener(printer);
            removeShutdownHook(shutdownHook);
        }

        ConsoleOutput.success("All workers stopped");
        return 0;
    }

    void shutdown() {
        if (orchestrator.getState() == WorkerOrchestrator.State.STOPPED) {
            return;
        }
        log.info("Shutdown requested, saving iteration state and stopping workers");
        // Stopping the pool kills running agents, after which they no longer count as active.
        instanceRegistry.saveAllIterationStates().join();
        orchestrator.stop();
        instanceRegistry.disposeAll().join();
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
