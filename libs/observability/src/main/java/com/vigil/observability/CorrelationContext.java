package com.vigil.observability;

/**
 * Immutable correlation context that flows through one monitoring run.
 * <p>
 * Every run (an HTTP request, a scheduled agent invocation, a per-destination fan-out step)
 * establishes a {@code CorrelationContext}. Its values are injected into SLF4J MDC so that every
 * log line emitted by probes, dispatchers and stores can be traced back to the run that caused
 * it.
 *
 * @param correlationId unique ID for the run (propagated from {@code X-Correlation-ID} when present)
 * @param tenantId      destination (tenant) the run targets; null for shared runs
 * @param agent         agent key executing the run; null outside agent runs
 * @param requestId     unique ID for this specific request (one correlation may span several)
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String agent,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant (destination) ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the agent key. */
    public static final String MDC_AGENT = "agent";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /** Returns a copy of this context scoped to the given agent and tenant. */
    public CorrelationContext forAgent(String agentKey, String tenant) {
        return new CorrelationContext(correlationId, tenant, agentKey, requestId, spanId, traceId);
    }
}
