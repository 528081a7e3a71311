package com.crewloop.core.tasks;

public class TaskSourceException extends RuntimeException {

    public TaskSourceException(String message) {
        super(message);
    }

    public TaskSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
