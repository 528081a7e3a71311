package com.crewloop.core.worker;

import com.crewloop.core.model.TestResult;

/**
 * Verifies the trunk after a clean merge.
 */
@FunctionalInterface
public interface TestRunner {

    TestResult runTests();
}
