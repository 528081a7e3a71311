package com.crewloop.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of checking one dependency the crewloop needs before it can dispatch work:
 * {@code git}, the coding {@code agent}, the {@code tasks} tracker or the {@code state-store}.
 *
 * @param component short component name shown by {@code crewloop health}
 * @param status    outcome of the check
 * @param detail    human-readable explanation, e.g. a version string or the missing command
 * @param metadata  extra key/value facts (paths, versions); never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /**
     * DEGRADED means the loop can run with reduced guarantees (no checkpoints, no repository yet);
     * DOWN means it cannot run at all.
     */
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus up(String component, String detail) {
        return up(component, detail, Map.of());
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /** Worst status across the checks: DOWN beats DEGRADED beats UP. An empty set is UP. */
    public static Status overall(Collection<HealthStatus> checks) {
        if (checks.stream().anyMatch(HealthStatus::isDown)) {
            return Status.DOWN;
        }
        return checks.stream().allMatch(HealthStatus::isUp) ? Status.UP : Status.DEGRADED;
    }
}
