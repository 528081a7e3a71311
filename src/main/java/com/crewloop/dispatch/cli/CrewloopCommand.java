package com.crewloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, state, health.
 */
@Command(
        name = "crewloop",
        mixinStandardHelpOptions = true,
        version = "crewloop 0.1.0",
        description = "Runs AI coding agents on ready tasks, one git worktree per worker",
        subcommands = {
                RunCommand.class,
                StateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CrewloopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
