package com.vigil.healthmonitor.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.monitoring.agent.UnknownAgentException;
import com.vigil.monitoring.issue.IssueNotFoundException;
import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import java.net.URI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps an unknown agent to 404")
    void handlesUnknownAgent() {
        ProblemDetail result = handler.handleUnknownAgent(new UnknownAgentException("ghost"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getTitle()).isEqualTo("Not Found");
        assertThat(result.getDetail()).isEqualTo("Unknown agent: ghost");
        assertThat(result.getType()).isEqualTo(URI.create("https://vigil.dev/errors/not-found"));
    }

    @Test
    @DisplayName("maps an unknown issue to 404")
    void handlesIssueNotFound() {
        ProblemDetail result =
                handler.handleIssueNotFound(new IssueNotFoundException("ISSUE-20260305-004"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).isEqualTo("Issue not found: ISSUE-20260305-004");
    }

    @Test
    @DisplayName("maps an illegal lifecycle transition to 409 Conflict")
    void handlesIllegalStateAsConflict() {
        ProblemDetail result =
                handler.handleIllegalState(new IllegalStateException("Cannot start issue in status resolved"));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getTitle()).isEqualTo("Conflict");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("Unknown severity: huge"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("Unknown severity: huge");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("hides the cause of unexpected errors")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("password=hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("includes the timestamp and the current correlation ID")
    void includesTimestampAndCorrelationId() {
        CorrelationContextHolder.set(CorrelationContext.of("cid-42"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "cid-42");
    }

    @Test
    @DisplayName("omits the correlation ID outside a request")
    void omitsCorrelationIdWithoutContext() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).doesNotContainKey("correlationId");
    }
}
