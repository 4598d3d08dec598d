package com.arbor.hierarchy.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.arbor.hierarchy.domain.exceptions.DependencyConflictException;
import com.arbor.hierarchy.domain.exceptions.NodeNotFoundException;
import com.arbor.hierarchy.domain.exceptions.StructuralConflictException;
import com.arbor.hierarchy.domain.exceptions.TenantLockUnavailableException;
import com.arbor.observability.CorrelationContext;
import com.arbor.observability.CorrelationContextHolder;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

/**
 * Plain unit tests of the exception mapping, no Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps NodeNotFoundException to 404")
    void notFound() {
        ProblemDetail result = handler.handleNotFound(new NodeNotFoundException("Node", "n1"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).isEqualTo("Node not found: n1");
        assertThat(result.getType().toString()).endsWith("/not-found");
    }

    @Test
    @DisplayName("maps both conflict kinds to 409 with distinct types")
    void conflicts() {
        ProblemDetail structural = handler.handleStructuralConflict(StructuralConflictException.cycle("n2", "n4"));
        ProblemDetail dependency = handler.handleDependencyConflict(DependencyConflictException.activeChildren("n2", 3));

        assertThat(structural.getStatus()).isEqualTo(409);
        assertThat(dependency.getStatus()).isEqualTo(409);
        assertThat(structural.getType()).isNotEqualTo(dependency.getType());
        assertThat(dependency.getProperties()).containsEntry("dependency", "ACTIVE_CHILDREN");
    }

    @Test
    @DisplayName("maps a busy tenant to 503")
    void lockUnavailable() {
        ProblemDetail result = handler.handleLockUnavailable(
                new TenantLockUnavailableException("t1", Duration.ofSeconds(10)));

        assertThat(result.getStatus()).isEqualTo(503);
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400")
    void badRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps anything else to 500 without leaking the message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("db password is hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("hunter2");
    }

    @Test
    @DisplayName("includes timestamp and correlation ID")
    void enrichment() {
        CorrelationContextHolder.set(CorrelationContext.forRequest("corr-1", "req-1"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-1");
    }
}
