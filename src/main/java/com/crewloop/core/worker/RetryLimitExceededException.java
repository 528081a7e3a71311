package com.crewloop.core.worker;

public class RetryLimitExceededException extends WorkerLoopException {

    public RetryLimitExceededException(String taskId, int maxAttempts) {
        super("Task %s not integrated after %d agent runs".formatted(taskId, maxAttempts));
    }
}
