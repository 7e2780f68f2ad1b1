package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Availability and responsiveness of a public front-end.
 * <p>
 * 4xx/5xx are unhealthy. Otherwise a response slower than 5s is degraded and slower than 3s a
 * warning.
 */
public final class FrontendCheck extends AbstractTimedCheck {

    static final Duration DEGRADED_AFTER = Duration.ofSeconds(5);
    static final Duration WARNING_AFTER = Duration.ofSeconds(3);

    private final URI url;
    private final Duration timeout;
    private final HttpProber prober;

    public FrontendCheck(String name, URI url, Duration timeout, HttpProber prober) {
        super(name, CheckCategory.FRONTENDS);
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        this.url = url;
        this.timeout = timeout;
        this.prober = prober;
    }

    @Override
    protected ProbeOutcome probe() {
        long start = System.nanoTime();
        HttpProbeResponse response = prober.get(url, timeout);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("statusCode", response.statusCode());
        metrics.put("responseTimeMs", elapsedMs);

        if (response.statusCode() >= 400) {
            return new ProbeOutcome(HealthStatus.UNHEALTHY, "HTTP " + response.statusCode(), metrics);
        }
        return ProbeOutcome.of(classifyLatency(elapsedMs), metrics);
    }

    static HealthStatus classifyLatency(long elapsedMs) {
        if (elapsedMs > DEGRADED_AFTER.toMillis()) {
            return HealthStatus.DEGRADED;
        }
        if (elapsedMs > WARNING_AFTER.toMillis()) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }
}
