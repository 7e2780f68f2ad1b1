package com.vigil.healthmonitor.api;

import com.vigil.monitoring.health.HealthReport;
import com.vigil.monitoring.health.HealthReporter;
import com.vigil.monitoring.metrics.MonitoringMetrics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes. Both return the full {@link HealthReport}; the status code is 200
 * while the platform can serve traffic (healthy, degraded or warning) and 503 otherwise.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthReporter reporter;
    private final MonitoringMetrics metrics;

    public HealthController(HealthReporter reporter, MonitoringMetrics metrics) {
        this.reporter = reporter;
        this.metrics = metrics;
    }

    /** Quick check: server ping, relational storage, cache and the primary dependency. */
    @GetMapping("/live")
    public ResponseEntity<HealthReport> live() {
        return toResponse(reporter.runQuickHealthCheck());
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthReport> ready() {
        HealthReport report = reporter.runFullHealthCheck();
        metrics.recordHealthReport(report);
        return toResponse(report);
    }

    private static ResponseEntity<HealthReport> toResponse(HealthReport report) {
        HttpStatus status = report.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(report);
    }
}
