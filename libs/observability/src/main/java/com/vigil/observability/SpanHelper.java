package com.vigil.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} used for agent runs and probe fan-out.
 * <p>
 * Each span receives the correlation ID, destination and agent of the current
 * {@link CorrelationContextHolder} context. The SDK itself (exporter, sampler) is configured by
 * the hosting service; without one the OpenTelemetry no-op tracer is used.
 */
public final class SpanHelper {

    /** Span attribute holding the correlation ID. */
    public static final String ATTR_CORRELATION_ID = "vigil.correlation_id";

    /** Span attribute holding the destination (tenant) ID. */
    public static final String ATTR_DESTINATION = "vigil.destination";

    /** Span attribute holding the agent key. */
    public static final String ATTR_AGENT = "vigil.agent";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside an INTERNAL span named {@code spanName}.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span with the given extra attributes. Runtime exceptions mark the
     * span as failed and are rethrown unchanged.
     *
     * @param spanName   span name, e.g. {@code agent.run}
     * @param attributes additional string attributes
     * @param work       the work to execute
     * @return the value produced by {@code work}
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        CorrelationContextHolder.get().ifPresent(ctx -> {
            builder.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantId() != null) {
                builder.setAttribute(ATTR_DESTINATION, ctx.tenantId());
            }
            if (ctx.agent() != null) {
                builder.setAttribute(ATTR_AGENT, ctx.agent());
            }
        });

        Span span = builder.startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #inSpan(String, Supplier)}.
     */
    public void inSpan(String spanName, Runnable work) {
        inSpan(spanName, Map.of(), () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
