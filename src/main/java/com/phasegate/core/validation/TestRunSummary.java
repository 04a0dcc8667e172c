package com.phasegate.core.validation;

import java.io.Serializable;

/**
 * Structured view of raw test runner output.
 */
public record TestRunSummary(
    boolean passed,
    int totalTests,
    int failedTests
) implements Serializable {}
