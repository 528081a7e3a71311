package com.crewloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Crewloop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorker(String workerName) {
        MDC.put("workerName", workerName);
    }

    public static void setTask(String workerName, String taskId) {
        MDC.put("workerName", workerName);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void setInstance(String instanceId) {
        MDC.put("instanceId", instanceId);
    }

    public static void clearInstance() {
        MDC.remove("instanceId");
    }

    public static void clear() {
        MDC.remove("workerName");
        MDC.remove("taskId");
        MDC.remove("instanceId");
    }
}
