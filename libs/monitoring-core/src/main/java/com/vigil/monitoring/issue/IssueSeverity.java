package com.vigil.monitoring.issue;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Issue severity with its resolution SLA. Declared from most to least severe.
 */
public enum IssueSeverity {
    CRITICAL(Duration.ofHours(24)),
    HIGH(Duration.ofHours(72)),
    MEDIUM(Duration.ofDays(7)),
    LOW(Duration.ofDays(30)),
    INFO(null);

    private final Duration sla;

    IssueSeverity(Duration sla) {
        this.sla = sla;
    }

    public Optional<Duration> sla() {
        return Optional.ofNullable(sla);
    }

    /** SLA deadline for an issue detected at {@code detectedAt}; null for {@link #INFO}. */
    public Instant slaTarget(Instant detectedAt) {
        return sla != null ? detectedAt.plus(sla) : null;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IssueSeverity fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
