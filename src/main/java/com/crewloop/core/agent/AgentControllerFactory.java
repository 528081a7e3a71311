package com.crewloop.core.agent;

import java.nio.file.Path;

/**
 * Creates a controller whose agent will run in the given directory, one per registry instance.
 */
@FunctionalInterface
public interface AgentControllerFactory {

    AgentProcessController create(Path workingDirectory);
}
