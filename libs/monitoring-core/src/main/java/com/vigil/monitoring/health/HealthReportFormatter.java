package com.vigil.monitoring.health;

import com.vigil.monitoring.check.CheckResult;
import com.vigil.observability.HealthStatus;

import java.time.format.DateTimeFormatter;

/**
 * Renders a {@link HealthReport} as the plain-text body used in alerts.
 */
public final class HealthReportFormatter {

    private HealthReportFormatter() {
    }

    public static String format(HealthReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Platform health: ").append(report.overallStatus())
                .append(" (").append(DateTimeFormatter.ISO_INSTANT.format(report.timestamp())).append(")\n");
        HealthSummary summary = report.summary();
        sb.append(summary.totalChecks()).append(" checks, ")
                .append(summary.critical()).append(" critical, ")
                .append(summary.unhealthy()).append(" unhealthy, ")
                .append(summary.warning()).append(" warning\n");

        for (CategoryReport category : report.categories().values()) {
            sb.append('\n').append(category.category().key()).append(": ").append(category.status());
            for (CheckResult check : category.checks()) {
                if (check.status() == HealthStatus.HEALTHY) {
                    continue;
                }
                sb.append("\n  - ").append(check.checkName()).append(": ").append(check.status());
                if (check.error() != null) {
                    sb.append(" (").append(check.error()).append(')');
                }
            }
        }
        return sb.toString();
    }
}
