package com.crewloop.core.registry;

/**
 * Task an instance is working on. Both fields are null between tasks.
 */
public record CurrentTask(String taskId, String taskTitle) {}
