package com.crewloop.core.worker;

public class WorkerLoopException extends RuntimeException {

    public WorkerLoopException(String message) {
        super(message);
    }

    public WorkerLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
