package com.arbor.hierarchy.infrastructure.web;

import com.arbor.hierarchy.domain.exceptions.DependencyConflictException;
import com.arbor.hierarchy.domain.exceptions.NodeNotFoundException;
import com.arbor.hierarchy.domain.exceptions.StructuralConflictException;
import com.arbor.hierarchy.domain.exceptions.TenantLockUnavailableException;
import com.arbor.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>The hierarchy failures map one to one: not found to 404, structural and dependency conflicts
 * to 409 (with distinct problem types), a busy tenant to 503. Every response carries a timestamp
 * and the request's correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://arbor.dev/errors/";

    @ExceptionHandler(NodeNotFoundException.class)
    public ProblemDetail handleNotFound(NodeNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(StructuralConflictException.class)
    public ProblemDetail handleStructuralConflict(StructuralConflictException ex) {
        return problem(HttpStatus.CONFLICT, "Structural Conflict", "structural-conflict", ex.getMessage());
    }

    @ExceptionHandler(DependencyConflictException.class)
    public ProblemDetail handleDependencyConflict(DependencyConflictException ex) {
        ProblemDetail problem =
                problem(HttpStatus.CONFLICT, "Dependency Conflict", "dependency-conflict", ex.getMessage());
        problem.setProperty("dependency", ex.dependency().name());
        return problem;
    }

    @ExceptionHandler(TenantLockUnavailableException.class)
    public ProblemDetail handleLockUnavailable(TenantLockUnavailableException ex) {
        log.warn("Tenant busy: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Tenant Busy", "tenant-busy", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ProblemDetail handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
