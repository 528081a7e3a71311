package com.crewloop.core.registry;

import java.nio.file.Path;

/**
 * Parameters of {@link InstanceRegistry#create(CreateInstanceOptions)}.
 *
 * @param id           unique instance id
 * @param name         display name
 * @param agentName    name of the agent persona running in the instance
 * @param worktreePath working directory, or null for the registry's main workspace
 * @param branch       branch checked out in the worktree, may be null
 */
public record CreateInstanceOptions(
    String id,
    String name,
    String agentName,
    Path worktreePath,
    String branch
) {
    public static CreateInstanceOptions of(String id) {
        return new CreateInstanceOptions(id, id, null, null, null);
    }
}
