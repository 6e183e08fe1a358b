package com.keystone.apiserver.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.observability.RequestContext;
import com.keystone.observability.RequestContextHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void badRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("User id must be numeric: abc"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("User id must be numeric: abc");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
        assertThat(result.getType().toString()).isEqualTo("https://keystone.dev/errors/bad-request");
    }

    @Test
    @DisplayName("maps a duplicate key to 409 Conflict without the SQL")
    void duplicateKey() {
        ProblemDetail result = handler.handleDataIntegrity(new DuplicateKeyException(
                "Unique index or primary key violation: UQ_USERS_EMAIL"));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getTitle()).isEqualTo("Conflict");
        assertThat(result.getType().toString()).isEqualTo("https://keystone.dev/errors/conflict");
        assertThat(result.getDetail()).doesNotContain("UQ_USERS_EMAIL");
    }

    @Test
    @DisplayName("maps other constraint violations to 400")
    void constraintViolation() {
        ProblemDetail result = handler.handleDataIntegrity(new DataIntegrityViolationException(
                "NULL not allowed for column \"email\""));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getType().toString())
                .isEqualTo("https://keystone.dev/errors/constraint-violation");
        assertThat(result.getDetail()).doesNotContain("email");
    }

    @Test
    @DisplayName("maps any other exception to 500 without leaking its message")
    void internalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("connection reset"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("connection reset");
    }

    @Test
    @DisplayName("includes timestamp and request id")
    void includesTimestampAndRequestId() {
        RequestContextHolder.set(RequestContext.of("req-7"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("requestId", "req-7");
    }
}
