package com.keystone.apiserver.infrastructure.web;

import com.keystone.observability.RequestContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps handler failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://keystone.dev/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "User id must be numeric: abc",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "requestId": "abc-123"
 * }
 * </pre>
 *
 * <p>Route misses never get here; the router answers them itself.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Request body could not be read", "Bad Request", "bad-request");
    }

    /**
     * A unique key clash is a 409; any other constraint (a missing required column) is a 400. The
     * SQL message stays in the log.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        if (ex instanceof DuplicateKeyException) {
            return problem(HttpStatus.CONFLICT, "Resource already exists", "Conflict", "conflict");
        }
        return problem(
                HttpStatus.BAD_REQUEST,
                "Request violates a data constraint",
                "Bad Request",
                "constraint-violation");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "Internal Server Error",
                "internal");
    }

    private static ProblemDetail problem(
            HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://keystone.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        RequestContextHolder.get()
                .ifPresent(context -> problem.setProperty("requestId", context.requestId()));
        return problem;
    }
}
