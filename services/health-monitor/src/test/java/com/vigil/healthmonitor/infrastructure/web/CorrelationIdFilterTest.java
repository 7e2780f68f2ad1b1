package com.vigil.healthmonitor.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static FilterChain capturing(AtomicReference<CorrelationContext> captured) {
        return (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
    }

    @Test
    @DisplayName("generates a correlation ID when none is provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("treats a blank header as missing")
    void replacesBlankCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "  ");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank().isNotEqualTo("  ");
    }

    @Test
    @DisplayName("propagates the caller's correlation ID through the chain")
    void propagatesExistingCorrelationId() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "sched-7781");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, capturing(captured));

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("sched-7781");
        assertThat(captured.get().correlationId()).isEqualTo("sched-7781");
        assertThat(captured.get().requestId()).isNotBlank();
    }

    @Test
    @DisplayName("tags the request with the destination header as tenant")
    void tagsDestination() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var request = new MockHttpServletRequest();
        request.addHeader("X-Destination-ID", "calpe");

        filter.doFilter(request, new MockHttpServletResponse(), capturing(captured));

        assertThat(captured.get().tenantId()).isEqualTo("calpe");
    }

    @Test
    @DisplayName("leaves the tenant empty without a destination header")
    void noDestinationWithoutHeader() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), capturing(captured));

        assertThat(captured.get().tenantId()).isNull();
    }

    @Test
    @DisplayName("clears the holder after the request, even when the chain throws")
    void clearsContextAfterRequest() {
        FilterChain failing =
                (req, resp) -> {
                    throw new IllegalStateException("boom");
                };

        assertThatThrownBy(
                        () -> filter.doFilter(
                                new MockHttpServletRequest(), new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
