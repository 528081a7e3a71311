package com.crewloop.dispatch.cli;

import com.crewloop.core.health.HealthCheckService;
import com.crewloop.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: crewloop health
 * <p>
 * Checks git, the agent command, the task tracker and the state store.
 * Exits with 1 when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        checks.forEach(ConsoleOutput::health);

        HealthStatus.Status overall = HealthStatus.overall(checks);
        System.out.println(ConsoleOutput.RULE);
        if (overall == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
