package com.crewloop.core.agent;

import com.crewloop.core.model.AgentEvent;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;

/**
 * Receives notifications from an {@link AgentProcessController}.
 * <p>
 * Callbacks run on the controller's reader threads; implementations must not block.
 */
public interface AgentListener {

    default void onEvent(AgentEvent event) {}

    default void onStatus(AgentStatus status) {}

    /** A stdout line that was not a JSON event. */
    default void onOutput(String line) {}

    default void onError(Throwable error) {}

    default void onExit(ExitInfo exit) {}
}
