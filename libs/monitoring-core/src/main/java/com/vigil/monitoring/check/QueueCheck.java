package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backlog and failure counts of one job queue: more than 50 failed or 1000 waiting jobs is
 * unhealthy, more than 10 failed a warning.
 */
public final class QueueCheck extends AbstractTimedCheck {

    static final long FAILED_UNHEALTHY = 50;
    static final long WAITING_UNHEALTHY = 1000;
    static final long FAILED_WARNING = 10;

    private final String queueName;
    private final QueueStatsSource source;

    public QueueCheck(String queueName, QueueStatsSource source) {
        super(queueName, CheckCategory.QUEUES);
        this.queueName = queueName;
        this.source = source;
    }

    @Override
    protected ProbeOutcome probe() throws Exception {
        QueueStats stats = source.stats(queueName);
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("waiting", stats.waiting());
        metrics.put("active", stats.active());
        metrics.put("completed", stats.completed());
        metrics.put("failed", stats.failed());
        metrics.put("delayed", stats.delayed());
        return ProbeOutcome.of(classify(stats), metrics);
    }

    static HealthStatus classify(QueueStats stats) {
        if (stats.failed() > FAILED_UNHEALTHY || stats.waiting() > WAITING_UNHEALTHY) {
            return HealthStatus.UNHEALTHY;
        }
        if (stats.failed() > FAILED_WARNING) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }
}
