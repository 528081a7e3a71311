package com.crewloop.core.workspace;

/**
 * A git or filesystem operation on a workspace failed.
 */
public class WorkspaceException extends RuntimeException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
