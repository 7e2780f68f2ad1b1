package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Base class for probes: measures latency and converts any exception into a failed
 * {@link CheckResult}.
 * <p>
 * Subclasses implement {@link #probe()} and may throw freely. The status used for exceptions is
 * {@link HealthStatus#ERROR} unless {@link #failureStatus()} is overridden.
 */
public abstract class AbstractTimedCheck implements HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(AbstractTimedCheck.class);

    private final String name;
    private final CheckCategory category;

    protected AbstractTimedCheck(String name, CheckCategory category) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        this.name = name;
        this.category = category;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final CheckCategory category() {
        return category;
    }

    @Override
    public final CheckResult check() {
        long start = System.nanoTime();
        try {
            ProbeOutcome outcome = probe();
            return new CheckResult(name, category, outcome.status(), elapsedMs(start), outcome.error(),
                    Instant.now(), outcome.metrics());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Probe {}:{} failed: {}", category.key(), name, describe(e));
            return CheckResult.failed(name, category, failureStatus(), describe(e), elapsedMs(start));
        }
    }

    /**
     * Performs the probe. Any exception becomes a {@link #failureStatus()} result.
     */
    protected abstract ProbeOutcome probe() throws Exception;

    protected HealthStatus failureStatus() {
        return HealthStatus.ERROR;
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
