package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.SharedAgent;
import com.vigil.monitoring.smoke.SmokeTestReport;
import com.vigil.monitoring.smoke.SmokeTestRunner;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Complete smoke suite: every active destination, the shared infrastructure and the alert channel
 * configuration. Fails when any test failed.
 */
@Component
@Order(20)
public class SmokeTestAgent implements SharedAgent {

    public static final String KEY = "smoke-tests";

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(KEY, "Smoke Tests", "Read-only end-to-end checks", "A", "1.0.0", false);

    private final SmokeTestRunner runner;

    public SmokeTestAgent(SmokeTestRunner runner) {
        this.runner = runner;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome execute() {
        SmokeTestReport report = runner.runAllSmokeTests();
        String summary = report.totalPassed() + "/" + report.totalTests() + " smoke tests passed";
        Map<String, Object> details =
                Map.of(
                        "passed", report.totalPassed(),
                        "failed", report.totalFailed(),
                        "failedTests", report.failedTestNames(),
                        "alertChannel", report.channelConfig().status().name());
        return report.totalFailed() == 0
                ? AgentOutcome.success(summary, details)
                : AgentOutcome.failure(summary, details);
    }
}
