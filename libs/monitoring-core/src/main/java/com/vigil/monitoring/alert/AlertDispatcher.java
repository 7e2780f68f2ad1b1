package com.vigil.monitoring.alert;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.monitoring.health.CategoryReport;
import com.vigil.monitoring.health.HealthReport;
import com.vigil.monitoring.health.HealthReportFormatter;
import com.vigil.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Rate-limited alert delivery.
 * <p>
 * Each alert key may be sent at most once per cooldown window of its urgency. The check and the
 * reservation of the send slot happen in a single atomic map operation, so two concurrent
 * dispatches of the same key cannot both send. A failed send gives the slot back.
 * <p>
 * Immediate dispatches skip the cooldown check but still record the send time.
 */
public final class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Notifier notifier;
    private final AlertPolicy policy;
    private final Clock clock;
    private final Consumer<DispatchResult> listener;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();
    private final Map<CheckCategory, HealthStatus> lastCategoryStatus = new ConcurrentHashMap<>();

    public AlertDispatcher(Notifier notifier, AlertPolicy policy, Clock clock) {
        this(notifier, policy, clock, result -> {
        });
    }

    /**
     * @param listener receives every {@link DispatchResult}, e.g. for metrics
     */
    public AlertDispatcher(Notifier notifier, AlertPolicy policy, Clock clock, Consumer<DispatchResult> listener) {
        if (notifier == null) {
            throw new IllegalArgumentException("notifier must not be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.notifier = notifier;
        this.policy = policy;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Sends the alert unless its key is still cooling down.
     */
    public DispatchResult dispatch(AlertRequest request) {
        return send(request, false);
    }

    /**
     * Sends the alert regardless of cooldown.
     */
    public DispatchResult dispatchImmediate(AlertRequest request) {
        return send(request, true);
    }

    /**
     * Sends an alert for a status using the policy's urgency.
     */
    public DispatchResult dispatchStatus(String alertKey, HealthStatus status, String subject, String message,
                                         String category, Map<String, Object> metadata) {
        return dispatch(new AlertRequest(alertKey, policy.urgencyFor(status), subject, message, category, metadata));
    }

    /**
     * Alerts on a health report: one overall alert keyed {@code overall:<status>} when the platform
     * is not healthy, an immediate alert per CRITICAL check, and a recovery notice for every
     * category that returned to healthy since the previous report.
     */
    public List<DispatchResult> dispatchHealthReport(HealthReport report) {
        List<DispatchResult> results = new ArrayList<>();
        HealthStatus overall = report.overallStatus();

        if (overall != HealthStatus.HEALTHY) {
            String key = "overall:" + statusKey(overall);
            results.add(dispatchStatus(key, overall, "Platform health " + overall,
                    HealthReportFormatter.format(report), "health", Map.of("overallStatus", overall.name())));
        }

        for (CheckResult check : report.allChecks()) {
            if (check.status() == HealthStatus.CRITICAL) {
                results.add(dispatchImmediate(new AlertRequest(alertKey(check),
                        policy.urgencyFor(HealthStatus.CRITICAL),
                        "CRITICAL: " + check.category().key() + "/" + check.checkName(),
                        check.error() != null ? check.error() : "Check reported CRITICAL",
                        "health", Map.of("check", check.key()))));
            }
        }

        for (CategoryReport category : report.categories().values()) {
            HealthStatus previous = lastCategoryStatus.put(category.category(), category.status());
            if (previous != null && previous.isProblem() && category.status() == HealthStatus.HEALTHY) {
                results.add(sendRecovery(category.category(), previous));
            }
        }
        return results;
    }

    /**
     * Returns true when an alert with this key and urgency would currently be suppressed.
     */
    public boolean isCoolingDown(String alertKey, int urgency) {
        Instant sentAt = lastSent.get(alertKey);
        return sentAt != null && withinCooldown(sentAt, clock.instant(), policy.cooldownFor(urgency));
    }

    public void clearCooldowns() {
        lastSent.clear();
    }

    public AlertPolicy policy() {
        return policy;
    }

    /** Alert key of a check result: {@code category:check:status}. */
    public static String alertKey(CheckResult check) {
        return check.category().key() + ":" + check.checkName() + ":" + statusKey(check.status());
    }

    private DispatchResult sendRecovery(CheckCategory category, HealthStatus previous) {
        log.info("Category {} recovered from {}", category.key(), previous);
        return dispatchImmediate(new AlertRequest("recovery:" + category.key(),
                policy.urgencyFor(HealthStatus.HEALTHY),
                "Recovered: " + category.key(),
                category.key() + " is healthy again (was " + previous + ")",
                "health", Map.of("category", category.key(), "previousStatus", previous.name())));
    }

    private DispatchResult send(AlertRequest request, boolean bypassCooldown) {
        String key = request.alertKey();
        Instant now = clock.instant();
        Duration cooldown = policy.cooldownFor(request.urgency());
        AtomicBoolean reserved = new AtomicBoolean();
        AtomicReference<Instant> previous = new AtomicReference<>();

        lastSent.compute(key, (k, sentAt) -> {
            if (!bypassCooldown && sentAt != null && withinCooldown(sentAt, now, cooldown)) {
                return sentAt;
            }
            previous.set(sentAt);
            reserved.set(true);
            return now;
        });

        if (!reserved.get()) {
            log.debug("Alert {} suppressed, cooling down for {}", key, cooldown);
            return publish(DispatchResult.suppressed(key, request.urgency()));
        }

        try {
            NotificationReceipt receipt = notifier.sendNotification(request.toNotification());
            log.info("Alert {} sent (urgency {}) via {}", key, request.urgency(), receipt.channels());
            return publish(DispatchResult.sent(key, request.urgency(), receipt.channels()));
        } catch (RuntimeException e) {
            lastSent.compute(key, (k, sentAt) -> sentAt == now ? previous.get() : sentAt);
            log.error("Alert {} could not be delivered: {}", key, e.getMessage(), e);
            return publish(DispatchResult.failed(key, request.urgency(), e.getMessage()));
        }
    }

    private DispatchResult publish(DispatchResult result) {
        try {
            listener.accept(result);
        } catch (RuntimeException e) {
            log.warn("Dispatch listener failed for {}: {}", result.alertKey(), e.getMessage());
        }
        return result;
    }

    private static boolean withinCooldown(Instant sentAt, Instant now, Duration cooldown) {
        return Duration.between(sentAt, now).compareTo(cooldown) < 0;
    }

    private static String statusKey(HealthStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
