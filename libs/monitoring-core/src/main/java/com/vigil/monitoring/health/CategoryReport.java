package com.vigil.monitoring.health;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.observability.HealthStatus;

import java.util.List;

/**
 * Results of all probes in one category. The status is always the worst of its checks.
 */
public record CategoryReport(CheckCategory category, List<CheckResult> checks, HealthStatus status) {

    public CategoryReport {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        checks = checks != null ? List.copyOf(checks) : List.of();
        status = HealthStatus.worstOf(checks.stream().map(CheckResult::status).toList());
    }

    public static CategoryReport of(CheckCategory category, List<CheckResult> checks) {
        return new CategoryReport(category, checks, null);
    }
}
