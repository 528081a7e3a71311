package com.crewloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an agent process as seen by its controller.
 * <p>
 * Serialized with the lowercase wire values used in persisted iteration state.
 */
public enum AgentStatus {
    STOPPED("stopped"),
    STARTING("starting"),
    RUNNING("running"),
    PAUSING("pausing"),
    PAUSED("paused"),
    STOPPING("stopping"),
    STOPPING_AFTER_CURRENT("stopping_after_current");

    private final String wireValue;

    AgentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AgentStatus fromWire(String value) {
        for (AgentStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }

    /**
     * True while the process has a live stdin and accepts user messages.
     */
    public boolean acceptsMessages() {
        return this == RUNNING || this == PAUSED || this == PAUSING || this == STOPPING_AFTER_CURRENT;
    }

    /**
     * True for the states in which an instance is worth checkpointing before disposal.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
