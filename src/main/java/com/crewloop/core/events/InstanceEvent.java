package com.crewloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event on the registry's uniform, instance-tagged stream.
 *
 * @param eventType  dotted event name, e.g. {@code "instance.created"} or {@code "agent.event"}
 * @param instanceId the instance the event belongs to
 * @param payload    event-specific data
 * @param timestamp  when the event was published
 */
public record InstanceEvent(
        String eventType,
        String instanceId,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static final String INSTANCE_CREATED = "instance.created";
    public static final String INSTANCE_DISPOSED = "instance.disposed";
    public static final String INSTANCE_MERGE_CONFLICT = "instance.merge_conflict";
    public static final String AGENT_EVENT = "agent.event";
    public static final String AGENT_STATUS = "agent.status";
    public static final String AGENT_OUTPUT = "agent.output";
    public static final String AGENT_ERROR = "agent.error";
    public static final String AGENT_EXIT = "agent.exit";

    public static InstanceEvent of(String eventType, String instanceId, Map<String, Object> payload) {
        return new InstanceEvent(eventType, instanceId, payload, Instant.now());
    }
}
