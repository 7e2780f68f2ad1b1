package com.vigil.monitoring.audit;

import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.observability.CorrelationContextHolder;
import com.vigil.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Appends agent activity and errors to history.
 * <p>
 * Metadata is redacted before it is stored, a {@code status} outside the allowed set is dropped,
 * and a failing store is logged at WARN; callers are never interrupted by auditing.
 */
public final class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    public static final Set<String> ALLOWED_STATUSES = Set.of("initiated", "completed", "failed", "pending_approval");
    public static final String ERROR_ACTION = "error";

    private final HistoryStore history;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public AuditLogger(HistoryStore history, SensitiveDataRedactor redactor, Clock clock) {
        this.history = history;
        this.redactor = redactor;
        this.clock = clock;
    }

    public void logAgent(String agentName, String action, String description, Map<String, Object> metadata) {
        Map<String, Object> cleaned = new LinkedHashMap<>(redactor.redact(metadata));
        Object status = cleaned.remove("status");
        String validStatus = status != null && ALLOWED_STATUSES.contains(status.toString()) ? status.toString() : null;
        if (status != null && validStatus == null) {
            log.debug("Dropping unsupported audit status '{}' for {}/{}", status, agentName, action);
        }
        Object destination = cleaned.remove("destinationId");
        CorrelationContextHolder.get().ifPresent(ctx -> cleaned.putIfAbsent("correlationId", ctx.correlationId()));
        append(new HistoryEntry(null, agentName, action, destination != null ? destination.toString() : null,
                clock.instant(), validStatus, description, cleaned));
    }

    public void logError(String agentName, Throwable error, Map<String, Object> context) {
        Map<String, Object> metadata = new LinkedHashMap<>(redactor.redact(context));
        metadata.put("errorType", error.getClass().getName());
        append(new HistoryEntry(null, agentName, ERROR_ACTION, null, clock.instant(), "failed",
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), metadata));
    }

    private void append(HistoryEntry entry) {
        try {
            history.append(entry);
        } catch (RuntimeException e) {
            log.warn("Audit entry {}/{} could not be stored: {}", entry.agentName(), entry.action(), e.getMessage());
        }
    }
}
