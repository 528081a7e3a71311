package com.crewloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A merge conflict recorded against an instance until it is resolved or aborted.
 *
 * @param files        conflicting file paths
 * @param sourceBranch branch that failed to merge
 * @param timestamp    detection time in epoch millis
 */
public record MergeConflict(
    List<String> files,
    String sourceBranch,
    long timestamp
) implements Serializable {
    public MergeConflict {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
