package com.bastion.gateway.infrastructure.web;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AdmissionError;
import com.bastion.security.ErrorCode;
import com.bastion.security.TenantMismatchException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://bastion.dev/errors/rate-limit-exceeded",
 *   "title": "Rate limit exceeded",
 *   "status": 429,
 *   "detail": "Rate limit exceeded, retry later",
 *   "code": "RATE_LIMIT_EXCEEDED",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Rate-limit rejections carry {@code Retry-After}; authentication failures carry
 * {@code WWW-Authenticate: Bearer}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ERROR_TYPE_BASE = "https://bastion.dev/errors/";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AdmissionRejectedException.class)
    public ResponseEntity<ProblemDetail> handleAdmissionRejected(AdmissionRejectedException ex) {
        return toResponse(ex.error());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTenantMismatch(TenantMismatchException ex) {
        log.warn("security_event=tenant_mismatch expected={} actual={}",
                ex.expectedTenantId(), ex.actualTenantId());
        return toResponse(AdmissionError.of(ErrorCode.TENANT_MISMATCH, null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, "Request body is missing or malformed");
        problem.setTitle("Malformed Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "malformed-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
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
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private ResponseEntity<ProblemDetail> toResponse(AdmissionError error) {
        ErrorCode code = error.code();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.valueOf(code.httpStatus()), error.detail());
        problem.setTitle(code.title());
        problem.setType(URI.create(ERROR_TYPE_BASE + code.slug()));
        problem.setProperty("code", code.name());
        if (error.reason() != null) {
            problem.setProperty("reason", error.reason());
        }
        enrichWithCorrelation(problem);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(code.httpStatus());
        if (code == ErrorCode.RATE_LIMIT_EXCEEDED) {
            response.header(HttpHeaders.RETRY_AFTER, Long.toString(error.retryAfterSeconds()));
        }
        if (code.isAuthenticationFailure()) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(problem);
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
