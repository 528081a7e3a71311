package com.crewloop.core.model;

import java.io.Serializable;

/**
 * Outcome of the post-merge test hook.
 */
public record TestResult(
    boolean success,
    String output
) implements Serializable {
    public static TestResult passed(String output) {
        return new TestResult(true, output);
    }

    public static TestResult failed(String output) {
        return new TestResult(false, output);
    }
}
