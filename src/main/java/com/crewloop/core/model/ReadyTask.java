package com.crewloop.core.model;

import java.io.Serializable;

/**
 * Immutable snapshot of a task the task source reports as ready to work on.
 */
public record ReadyTask(
    String id,
    String title
) implements Serializable {}
