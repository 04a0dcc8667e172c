package com.phasegate.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw test runner output into a {@link TestRunSummary}.
 * <p>
 * Recognizes Maven/JUnit ("Tests run: 10, Failures: 2, Errors: 1") and pytest ("8 passed, 2 failed")
 * summaries, then falls back to build-failure markers. A non-zero exit code always fails.
 * Counts too large for an int saturate at {@link Integer#MAX_VALUE}.
 */
public final class TestOutputParser {

    private static final Logger log = LoggerFactory.getLogger(TestOutputParser.class);

    /** Maven/JUnit style: "Tests run: 10, Failures: 2, Errors: 1". Errors count as failures. */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)(?:,\\s*Errors:\\s*(\\d+))?");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    /** mocha/vitest style: "12 passing" */
    private static final Pattern PASSING_PATTERN = Pattern.compile("(\\d+)\\s+passing");

    private static final Pattern FAIL_MARKER = Pattern.compile("\\bFAIL\\b");

    private static final Pattern BUILD_FAILURE_PATTERN =
            Pattern.compile("(?i)(BUILD FAILURE|BUILD FAILED|COMPILATION ERROR|npm ERR!)");

    private TestOutputParser() {
    }

    public static TestRunSummary parse(String output, int exitCode) {
        boolean exitOk = exitCode == 0;
        if (output == null || output.isBlank()) {
            return new TestRunSummary(exitOk, 0, 0);
        }

        // surefire prints one line per class, then the aggregate; the last line wins
        Matcher mavenMatcher = MAVEN_PATTERN.matcher(output);
        MatchResult maven = null;
        while (mavenMatcher.find()) {
            maven = mavenMatcher.toMatchResult();
        }
        if (maven != null) {
            int total = count(maven.group(1));
            int failed = sum(count(maven.group(2)), maven.group(3) != null ? count(maven.group(3)) : 0);
            return new TestRunSummary(exitOk && failed == 0, total, failed);
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(output);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(output);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        if (foundPassed || foundFailed) {
            int passed = foundPassed ? count(passedMatcher.group(1)) : 0;
            int failed = foundFailed ? count(failedMatcher.group(1)) : 0;
            return new TestRunSummary(exitOk && failed == 0, sum(passed, failed), failed);
        }

        Matcher passingMatcher = PASSING_PATTERN.matcher(output);
        if (passingMatcher.find()) {
            int passing = count(passingMatcher.group(1));
            boolean failure = FAIL_MARKER.matcher(output).find();
            return new TestRunSummary(exitOk && !failure, passing, failure ? 1 : 0);
        }

        if (BUILD_FAILURE_PATTERN.matcher(output).find()) {
            log.debug("Build/test failure marker found in test output");
            return new TestRunSummary(false, 0, 0);
        }

        return new TestRunSummary(exitOk, 0, 0);
    }

    private static int count(String digits) {
        try {
            return Math.toIntExact(Long.parseLong(digits));
        } catch (NumberFormatException | ArithmeticException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static int sum(int a, int b) {
        return (int) Math.min((long) a + b, Integer.MAX_VALUE);
    }
}
