package com.crewloop.core.persistence;

import com.crewloop.core.model.AgentEvent;

import java.util.List;

/**
 * Append-only per-instance log of agent events, used to recover history after a restart.
 */
public interface EventLogPersister {

    void append(String instanceId, AgentEvent event);

    List<AgentEvent> readEvents(String instanceId);

    /**
     * @return true if a log existed and was removed
     */
    boolean clear(String instanceId);

    boolean has(String instanceId);
}
