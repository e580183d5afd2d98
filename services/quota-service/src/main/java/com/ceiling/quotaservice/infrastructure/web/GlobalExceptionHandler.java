package com.ceiling.quotaservice.infrastructure.web;

import com.ceiling.observability.CorrelationContextHolder;
import com.ceiling.quota.QuotaErrorCode;
import com.ceiling.quota.QuotaException;
import java.net.URI;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler: maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>WHY: Quota failures carry a {@link QuotaErrorCode}; clients branch on the {@code code}
 * property rather than on the message:
 *
 * <pre>
 * {
 *   "type": "https://ceiling.dev/errors/quota.invalid-target",
 *   "title": "Unknown Quota Target",
 *   "status": 400,
 *   "detail": "unknown quota target: widget",
 *   "code": "quota.invalid-target",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every error response includes the correlation ID so support teams can trace errors back to
 * specific log entries.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://ceiling.dev/errors/";

    @ExceptionHandler(QuotaException.class)
    public ProblemDetail handleQuota(QuotaException ex) {
        HttpStatus status = statusFor(ex.code());
        if (status.is5xxServerError()) {
            log.error("Quota operation failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Quota request rejected [{}]: {}", ex.code().messageId(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(titleFor(ex.code()));
        problem.setType(URI.create(ERROR_TYPE_BASE + ex.code().messageId()));
        problem.setProperty("code", ex.code().messageId());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(CancellationException.class)
    public ProblemDetail handleCancellation(CancellationException ex) {
        log.warn("Quota operation cancelled: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.SERVICE_UNAVAILABLE, "The request was cancelled before usage was collected");
        problem.setTitle("Service Unavailable");
        problem.setType(URI.create(ERROR_TYPE_BASE + "cancelled"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad request parameter {}: {}", ex.getName(), ex.getValue());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, ex.getName() + " has an invalid value: " + ex.getValue());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request body is missing or malformed");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusFor(QuotaErrorCode code) {
        return switch (code) {
            case FEATURE_DISABLED -> HttpStatus.NOT_FOUND;
            case INVALID_SCOPE, MALFORMED_TAG, UNKNOWN_TARGET, UNKNOWN_TARGET_SERVICE -> HttpStatus.BAD_REQUEST;
            case REGISTRATION_CONFLICT -> HttpStatus.CONFLICT;
            case USAGE_UNAVAILABLE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String titleFor(QuotaErrorCode code) {
        return switch (code) {
            case FEATURE_DISABLED -> "Quotas Disabled";
            case INVALID_SCOPE -> "Invalid Quota Scope";
            case MALFORMED_TAG -> "Malformed Quota Tag";
            case UNKNOWN_TARGET -> "Unknown Quota Target";
            case UNKNOWN_TARGET_SERVICE -> "Unknown Quota Target Service";
            case REGISTRATION_CONFLICT -> "Quota Registration Conflict";
            case USAGE_UNAVAILABLE -> "Quota Usage Unavailable";
        };
    }

    /** Adds the correlation ID and a timestamp. */
    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
