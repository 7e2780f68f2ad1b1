package com.vigil.monitoring.alert;

import com.vigil.observability.HealthStatus;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Urgency per status and cooldown per urgency.
 * <p>
 * Defaults: critical 5, unhealthy/error 4, warning 3, degraded 2, healthy 1; cooldowns of 5, 15,
 * 60, 240 and 1440 minutes for urgency 5 down to 1. Deployments may override either table
 * partially; unspecified entries keep their default.
 */
public final class AlertPolicy {

    private static final Map<HealthStatus, Integer> DEFAULT_URGENCY = Map.of(
            HealthStatus.CRITICAL, 5,
            HealthStatus.UNHEALTHY, 4,
            HealthStatus.ERROR, 4,
            HealthStatus.WARNING, 3,
            HealthStatus.DEGRADED, 2,
            HealthStatus.HEALTHY, 1);

    private static final Map<Integer, Duration> DEFAULT_COOLDOWN = Map.of(
            5, Duration.ofMinutes(5),
            4, Duration.ofMinutes(15),
            3, Duration.ofMinutes(60),
            2, Duration.ofMinutes(240),
            1, Duration.ofMinutes(1440));

    private final Map<HealthStatus, Integer> urgencyByStatus;
    private final Map<Integer, Duration> cooldownByUrgency;

    public AlertPolicy(Map<HealthStatus, Integer> urgencyOverrides, Map<Integer, Duration> cooldownOverrides) {
        this.urgencyByStatus = new EnumMap<>(DEFAULT_URGENCY);
        this.cooldownByUrgency = new HashMap<>(DEFAULT_COOLDOWN);
        if (urgencyOverrides != null) {
            urgencyOverrides.forEach((status, urgency) -> {
                if (urgency < 1 || urgency > 5) {
                    throw new IllegalArgumentException("urgency for " + status + " must be between 1 and 5");
                }
                urgencyByStatus.put(status, urgency);
            });
        }
        if (cooldownOverrides != null) {
            cooldownOverrides.forEach((urgency, cooldown) -> {
                if (cooldown == null || cooldown.isNegative()) {
                    throw new IllegalArgumentException("cooldown for urgency " + urgency + " must not be negative");
                }
                cooldownByUrgency.put(urgency, cooldown);
            });
        }
    }

    public static AlertPolicy defaults() {
        return new AlertPolicy(Map.of(), Map.of());
    }

    public int urgencyFor(HealthStatus status) {
        return urgencyByStatus.get(status);
    }

    public Duration cooldownFor(int urgency) {
        Duration cooldown = cooldownByUrgency.get(urgency);
        if (cooldown == null) {
            throw new IllegalArgumentException("no cooldown for urgency " + urgency);
        }
        return cooldown;
    }
}
