package com.vigil.healthmonitor.infrastructure.web;

import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID flows from the {@code X-Correlation-ID} request header into {@link
 * CorrelationContextHolder} (and from there into SLF4J MDC), through agent runs triggered by the
 * request, into the history entries written by the audit logger, and back to the caller as a
 * response header. The scheduler may send {@code X-Destination-ID} to tag the whole request with a
 * tenant.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String DESTINATION_HEADER = "X-Destination-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String destination = request.getHeader(DESTINATION_HEADER);

        var context =
                new CorrelationContext(
                        correlationId,
                        destination != null && !destination.isBlank() ? destination : null,
                        null,
                        UUID.randomUUID().toString(),
                        null,
                        null);
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses request threads.
            CorrelationContextHolder.clear();
        }
    }
}
