package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connectivity to an external API via its status endpoint.
 * <p>
 * 2xx/3xx are healthy. 401 and 403 are also healthy: the dependency is reachable and only
 * rejected our credentials. Any other 4xx/5xx is unhealthy; transport failures are errors.
 */
public final class HttpDependencyCheck extends AbstractTimedCheck {

    private final URI endpoint;
    private final Duration timeout;
    private final HttpProber prober;

    public HttpDependencyCheck(String name, URI endpoint, Duration timeout, HttpProber prober) {
        super(name, CheckCategory.EXTERNAL);
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint must not be null");
        }
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.prober = prober;
    }

    @Override
    protected ProbeOutcome probe() {
        HttpProbeResponse response = prober.get(endpoint, timeout);
        int code = response.statusCode();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("statusCode", code);

        if (response.isSuccess()) {
            return ProbeOutcome.of(HealthStatus.HEALTHY, metrics);
        }
        if (code == 401 || code == 403) {
            metrics.put("authRejected", true);
            return ProbeOutcome.of(HealthStatus.HEALTHY, metrics);
        }
        return new ProbeOutcome(HealthStatus.UNHEALTHY, "HTTP " + code, metrics);
    }
}
