package com.crewloop.core.model;

/**
 * Outcome of integrating a worker branch into the trunk.
 */
public record MergeResult(
    boolean success,
    boolean hadConflicts,
    String message
) {
    public static MergeResult merged(String message) {
        return new MergeResult(true, false, message);
    }

    public static MergeResult conflicted(String message) {
        return new MergeResult(false, true, message);
    }

    public static MergeResult failed(String message) {
        return new MergeResult(false, false, message);
    }
}
