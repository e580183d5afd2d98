package com.ceiling.quotaservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ceiling.observability.CorrelationContext;
import com.ceiling.observability.CorrelationContextHolder;
import com.ceiling.quota.QuotaErrorCode;
import com.ceiling.quota.QuotaException;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.ProblemDetail;

/**
 * Unit tests for {@link GlobalExceptionHandler}.
 *
 * <p>WHY: Testing the handler as a plain unit (no Spring context) keeps the status mapping of every
 * quota error code fast to validate.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "FEATURE_DISABLED, 404",
        "INVALID_SCOPE, 400",
        "MALFORMED_TAG, 400",
        "UNKNOWN_TARGET, 400",
        "UNKNOWN_TARGET_SERVICE, 400",
        "REGISTRATION_CONFLICT, 409",
        "USAGE_UNAVAILABLE, 500"
    })
    @DisplayName("maps quota error codes to HTTP statuses")
    void mapsQuotaErrorCodes(QuotaErrorCode code, int status) {
        ProblemDetail result = handler.handleQuota(new QuotaException(code, "failed"));

        assertThat(result.getStatus()).isEqualTo(status);
        assertThat(result.getProperties()).containsEntry("code", code.messageId());
        assertThat(result.getType().toString()).endsWith(code.messageId());
    }

    @Test
    @DisplayName("maps a cancelled operation to 503 Service Unavailable")
    void handlesCancellationAsUnavailable() {
        ProblemDetail result = handler.handleCancellation(
                new CancellationException("interrupted while waiting for usage reporters"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getProperties()).containsKey("timestamp");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking the message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("connection string leaked"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("connection string");
    }

    @Test
    @DisplayName("error response includes timestamp and correlation ID")
    void errorResponseIncludesCorrelation() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-err"));

        ProblemDetail result = handler.handleQuota(
                new QuotaException(QuotaErrorCode.UNKNOWN_TARGET, "unknown quota target: widget"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "corr-err");
    }
}
