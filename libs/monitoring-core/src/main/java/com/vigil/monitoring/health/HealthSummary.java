package com.vigil.monitoring.health;

import com.vigil.monitoring.check.CheckResult;

import java.util.Collection;

/**
 * Machine-readable issue counts of a report. {@code unhealthy} includes ERROR results.
 */
public record HealthSummary(int totalChecks, int critical, int unhealthy, int warning, int degraded) {

    public static HealthSummary of(Collection<CheckResult> checks) {
        int critical = 0;
        int unhealthy = 0;
        int warning = 0;
        int degraded = 0;
        for (CheckResult check : checks) {
            switch (check.status()) {
                case CRITICAL -> critical++;
                case UNHEALTHY, ERROR -> unhealthy++;
                case WARNING -> warning++;
                case DEGRADED -> degraded++;
                default -> {
                }
            }
        }
        return new HealthSummary(checks.size(), critical, unhealthy, warning, degraded);
    }

    public int issues() {
        return critical + unhealthy + warning + degraded;
    }
}
