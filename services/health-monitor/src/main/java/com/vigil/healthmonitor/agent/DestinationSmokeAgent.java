package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.Destination;
import com.vigil.monitoring.agent.DestinationAwareAgent;
import com.vigil.monitoring.smoke.SmokeSuiteReport;
import com.vigil.monitoring.smoke.SmokeTestResult;
import com.vigil.monitoring.smoke.SmokeTestRunner;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Per-destination smoke tests, for targeting a single tenant after a deploy. Nothing is persisted
 * or alerted; the full suite does that.
 */
@Component
@Order(30)
public class DestinationSmokeAgent implements DestinationAwareAgent {

    public static final String KEY = "destination-smoke";

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(KEY, "Destination Smoke Tests", "Tenant API and front-end", "A", "1.0.0", true);

    private final SmokeTestRunner runner;

    public DestinationSmokeAgent(SmokeTestRunner runner) {
        this.runner = runner;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome runForDestination(Destination destination) {
        SmokeSuiteReport report = runner.runDestinationTests(destination);
        String summary =
                destination.code() + ": " + report.testsPassed() + "/" + report.testsTotal() + " passed";
        Map<String, Object> details =
                Map.of(
                        "passed", report.testsPassed(),
                        "failed", report.testsFailed(),
                        "failedTests", report.failures().stream().map(SmokeTestResult::name).toList());
        return report.testsFailed() == 0
                ? AgentOutcome.success(summary, details)
                : AgentOutcome.failure(summary, details);
    }
}
