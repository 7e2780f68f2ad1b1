package com.vigil.monitoring.correlation;

/**
 * Vulnerability totals of one security scan.
 */
public record VulnerabilityCounts(long total, long critical, long high) {
}
