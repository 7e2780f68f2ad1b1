package com.vigil.monitoring.smoke;

import java.time.Instant;
import java.util.List;

/**
 * Results of one group of smoke tests: the tests of a single destination, or the shared
 * infrastructure tests (with a null {@code destinationId}).
 */
public record SmokeSuiteReport(String destinationId, Instant timestamp, List<SmokeTestResult> results) {

    public SmokeSuiteReport {
        results = List.copyOf(results);
    }

    public int testsTotal() {
        return results.size();
    }

    public int testsPassed() {
        return (int) results.stream().filter(SmokeTestResult::passed).count();
    }

    public int testsFailed() {
        return testsTotal() - testsPassed();
    }

    public List<SmokeTestResult> failures() {
        return results.stream().filter(result -> !result.passed()).toList();
    }
}
