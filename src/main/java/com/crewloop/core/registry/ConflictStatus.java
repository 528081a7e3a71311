package com.crewloop.core.registry;

import com.crewloop.core.model.MergeConflict;

/**
 * Merge-conflict slot of an existing instance; {@code conflict} is null when there is none.
 */
public record ConflictStatus(MergeConflict conflict) {

    public boolean hasConflict() {
        return conflict != null;
    }
}
