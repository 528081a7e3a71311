package com.crewloop.core.worker;

import java.util.List;

/**
 * The conflict handler gave up on a task.
 */
public class MergeConflictException extends WorkerLoopException {

    private final List<String> conflictingFiles;

    public MergeConflictException(String message, List<String> conflictingFiles) {
        super(message);
        this.conflictingFiles = List.copyOf(conflictingFiles);
    }

    public List<String> getConflictingFiles() {
        return conflictingFiles;
    }
}
