package com.crewloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single event emitted by an agent process.
 * <p>
 * Events are opaque {@code {type, timestamp, ...fields}} objects; this class keeps the raw
 * field map and offers typed accessors for the fields the engine interprets. It serializes
 * back to the same flat JSON object it was read from.
 */
public final class AgentEvent {

    public static final String TASK_STARTED = "task_started";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String LOOP_PAUSED = "loop_paused";
    public static final String LOOP_RESUMED = "loop_resumed";
    public static final String RESULT = "result";
    public static final String MESSAGE_STOP = "message_stop";

    private final Map<String, Object> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AgentEvent(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields)));
    }

    public static AgentEvent of(String type, long timestamp, Map<String, Object> extra) {
        var map = new LinkedHashMap<String, Object>();
        map.put("type", type);
        map.put("timestamp", timestamp);
        if (extra != null) {
            map.putAll(extra);
        }
        return new AgentEvent(map);
    }

    public static AgentEvent of(String type, long timestamp) {
        return of(type, timestamp, null);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    public String type() {
        return getString("type");
    }

    /**
     * Event timestamp in epoch millis, or 0 when absent or not numeric.
     */
    public long timestamp() {
        Object value = fields.get("timestamp");
        return value instanceof Number n ? n.longValue() : 0L;
    }

    public boolean hasTimestamp() {
        return fields.get("timestamp") instanceof Number;
    }

    public String id() {
        return getString("id");
    }

    public Object get(String key) {
        return fields.get(key);
    }

    /**
     * Returns the field as a string, or null when it is absent or not a string.
     */
    public String getString(String key) {
        Object value = fields.get(key);
        return value instanceof String s ? s : null;
    }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(fields.get(key));
    }

    /**
     * Returns a nested object field, or an empty map when absent or not an object.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = fields.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    /**
     * Returns a copy of this event with the given field set.
     */
    public AgentEvent with(String key, Object value) {
        var map = new LinkedHashMap<>(fields);
        map.put(key, value);
        return new AgentEvent(map);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AgentEvent other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "AgentEvent" + fields;
    }
}
