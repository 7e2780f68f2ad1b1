package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Map;

/**
 * Reachability of the application host.
 */
public final class ServerPingCheck extends AbstractTimedCheck {

    /** Tests whether a host answers within a timeout. */
    @FunctionalInterface
    public interface Reachability {
        boolean isReachable(String host, Duration timeout) throws Exception;
    }

    private final String host;
    private final Duration timeout;
    private final Reachability reachability;

    public ServerPingCheck(String host, Duration timeout) {
        this(host, timeout, (h, t) -> InetAddress.getByName(h).isReachable((int) t.toMillis()));
    }

    public ServerPingCheck(String host, Duration timeout, Reachability reachability) {
        super("ping", CheckCategory.SERVER);
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be null or blank");
        }
        this.host = host;
        this.timeout = timeout;
        this.reachability = reachability;
    }

    @Override
    protected ProbeOutcome probe() throws Exception {
        if (reachability.isReachable(host, timeout)) {
            return ProbeOutcome.of(HealthStatus.HEALTHY, Map.of("host", host));
        }
        return new ProbeOutcome(HealthStatus.UNHEALTHY, host + " not reachable within " + timeout.toMillis() + "ms",
                Map.of("host", host));
    }
}
