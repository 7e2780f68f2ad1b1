package com.vigil.monitoring.testing;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.monitoring.check.HealthCheck;
import com.vigil.observability.HealthStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable probe: fixed status, optional delay, optional exception.
 */
public final class StubHealthCheck implements HealthCheck {

    private final String name;
    private final CheckCategory category;
    private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.HEALTHY);
    private final AtomicReference<Duration> delay = new AtomicReference<>(Duration.ZERO);
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final AtomicInteger invocations = new AtomicInteger();

    public StubHealthCheck(String name, CheckCategory category) {
        this.name = name;
        this.category = category;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CheckCategory category() {
        return category;
    }

    @Override
    public CheckResult check() {
        invocations.incrementAndGet();
        Duration wait = delay.get();
        if (!wait.isZero()) {
            try {
                Thread.sleep(wait.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        RuntimeException toThrow = failure.get();
        if (toThrow != null) {
            throw toThrow;
        }
        HealthStatus current = status.get();
        return current == HealthStatus.HEALTHY
                ? CheckResult.healthy(name, category, wait.toMillis())
                : CheckResult.failed(name, category, current, name + " is " + current, wait.toMillis());
    }

    public StubHealthCheck setStatus(HealthStatus newStatus) {
        status.set(newStatus);
        return this;
    }

    public StubHealthCheck setDelay(Duration newDelay) {
        delay.set(newDelay);
        return this;
    }

    public StubHealthCheck failWith(RuntimeException e) {
        failure.set(e);
        return this;
    }

    public int invocations() {
        return invocations.get();
    }
}
