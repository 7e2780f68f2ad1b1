package com.vigil.monitoring.correlation;

/**
 * Agent and action names under which the correlated agents write their history.
 */
public record CorrelationSources(
        String securityAgent,
        String securityAction,
        String performanceAgent,
        String performanceAction,
        String codeAgent,
        String codeAction,
        String healthAgent,
        String healthAction
) {

    public static CorrelationSources defaults() {
        return new CorrelationSources(
                "security-reviewer", "security_scan",
                "ux-ui-reviewer", "performance_check",
                "code-reviewer", "code_scan",
                "health-monitor", "health_check");
    }
}
