package com.vigil.monitoring.smoke;

import java.util.Map;

/**
 * Outcome of one smoke test.
 *
 * @param name       test name, e.g. {@code Resource List}
 * @param passed     whether the test passed
 * @param durationMs time spent, 0 for skipped tests
 * @param error      failure reason, null when passed
 * @param details    values observed by the test (status code, counts)
 */
public record SmokeTestResult(String name, boolean passed, long durationMs, String error,
                              Map<String, Object> details) {

    public SmokeTestResult {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    static SmokeTestResult skipped(String name, String reason) {
        return new SmokeTestResult(name, false, 0, "Skipped (" + reason + ")", Map.of());
    }
}
