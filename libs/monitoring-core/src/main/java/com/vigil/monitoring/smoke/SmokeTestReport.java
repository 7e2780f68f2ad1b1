package com.vigil.monitoring.smoke;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Combined smoke test run over all destinations and shared infrastructure.
 */
public record SmokeTestReport(Instant timestamp, List<SmokeSuiteReport> destinations,
                              SmokeSuiteReport infrastructure, ChannelConfigCheck channelConfig, long durationMs) {

    public SmokeTestReport {
        destinations = List.copyOf(destinations);
    }

    public int totalTests() {
        return suites().stream().mapToInt(SmokeSuiteReport::testsTotal).sum();
    }

    public int totalPassed() {
        return suites().stream().mapToInt(SmokeSuiteReport::testsPassed).sum();
    }

    public int totalFailed() {
        return totalTests() - totalPassed();
    }

    /** Failed tests named {@code <destination>/<test>}, or just the test name for infrastructure. */
    public List<String> failedTestNames() {
        List<String> names = new ArrayList<>();
        for (SmokeSuiteReport suite : suites()) {
            for (SmokeTestResult failure : suite.failures()) {
                names.add(suite.destinationId() != null ? suite.destinationId() + "/" + failure.name() : failure.name());
            }
        }
        return names;
    }

    private List<SmokeSuiteReport> suites() {
        List<SmokeSuiteReport> suites = new ArrayList<>(destinations);
        suites.add(infrastructure);
        return suites;
    }
}
