package com.vigil.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, all MDC keys (correlationId, tenantId, agent, requestId,
 * spanId, traceId) are populated so that every log statement on this thread includes them. When
 * cleared, all MDC keys are removed.
 * <p>
 * Probes run on pool threads; callers that fan out must transfer the context explicitly with
 * {@link #callWithContext(CorrelationContext, Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current context, or a fresh one with a random correlation ID.
     */
    public static CorrelationContext currentOrNew() {
        CorrelationContext current = CONTEXT.get();
        return current != null ? current : CorrelationContext.of(UUID.randomUUID().toString());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code supplier} with the given correlation context set, then restores the previous
     * context, or clears it if there was none.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_AGENT, ctx.agent());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        setMdc(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_AGENT);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }
}
