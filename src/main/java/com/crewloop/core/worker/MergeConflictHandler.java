package com.crewloop.core.worker;

import com.crewloop.core.model.ConflictResolution;
import com.crewloop.core.model.MergeConflictContext;

/**
 * Decides what a worker does when its branch does not merge cleanly.
 */
@FunctionalInterface
public interface MergeConflictHandler {

    ConflictResolution onMergeConflict(MergeConflictContext context);
}
