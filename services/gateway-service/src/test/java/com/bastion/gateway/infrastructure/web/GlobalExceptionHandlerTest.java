package com.bastion.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AdmissionError;
import com.bastion.security.ErrorCode;
import com.bastion.security.TenantMismatchException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("admission rejections")
    class AdmissionRejections {

        @Test
        @DisplayName("status, type and code follow the error code")
        void mapsErrorCode() {
            ResponseEntity<ProblemDetail> response = handler.handleAdmissionRejected(
                    new AdmissionRejectedException(AdmissionError.of(ErrorCode.TENANT_INACTIVE, null)));

            assertThat(response.getStatusCode().value()).isEqualTo(403);
            ProblemDetail body = response.getBody();
            assertThat(body.getType().toString()).isEqualTo("https://bastion.dev/errors/tenant-inactive");
            assertThat(body.getDetail()).isEqualTo("Tenant inactive");
            assertThat(body.getProperties()).containsEntry("code", "TENANT_INACTIVE");
            assertThat(response.getHeaders().getFirst("WWW-Authenticate")).isNull();
        }

        @Test
        @DisplayName("rate limit carries Retry-After rounded up to whole seconds")
        void retryAfter() {
            ResponseEntity<ProblemDetail> response = handler.handleAdmissionRejected(
                    new AdmissionRejectedException(AdmissionError.rateLimited(Duration.ofMillis(1200))));

            assertThat(response.getStatusCode().value()).isEqualTo(429);
            assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("2");
        }

        @Test
        @DisplayName("authentication failures carry a Bearer challenge")
        void bearerChallenge() {
            ResponseEntity<ProblemDetail> response = handler.handleAdmissionRejected(
                    new AdmissionRejectedException(AdmissionError.of(ErrorCode.TOKEN_EXPIRED, "Token expired")));

            assertThat(response.getStatusCode().value()).isEqualTo(401);
            assertThat(response.getHeaders().getFirst("WWW-Authenticate")).isEqualTo("Bearer");
        }

        @Test
        @DisplayName("forbidden includes the deny reason")
        void forbiddenReason() {
            ResponseEntity<ProblemDetail> response = handler.handleAdmissionRejected(
                    new AdmissionRejectedException(AdmissionError.forbidden("SELF_REMOVAL", "Cannot remove yourself")));

            assertThat(response.getBody().getProperties()).containsEntry("reason", "SELF_REMOVAL");
        }
    }

    @Test
    @DisplayName("maps TenantMismatchException to 403 without leaking tenant ids")
    void handlesTenantMismatch() {
        ResponseEntity<ProblemDetail> response =
                handler.handleTenantMismatch(new TenantMismatchException("tenant-a", "tenant-b"));

        assertThat(response.getStatusCode().value()).isEqualTo(403);
        assertThat(response.getBody().getDetail()).doesNotContain("tenant-a", "tenant-b");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps an unreadable body to 400 without echoing the parser message")
    void handlesUnreadableBody() {
        ProblemDetail result = handler.handleUnreadable(new HttpMessageNotReadableException(
                "JSON parse error: Unexpected character", new MockHttpInputMessage(new byte[0])));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Malformed Request");
        assertThat(result.getType().toString()).isEqualTo("https://bastion.dev/errors/malformed-request");
        assertThat(result.getDetail()).doesNotContain("Unexpected character");
    }

    @Test
    @DisplayName("maps generic Exception to 500 with timestamp and correlation id")
    void handlesGenericExceptionAsInternalError() {
        CorrelationContextHolder.set(CorrelationContext.forRequest("corr-1", "req-1"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("something broke");
        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-1");
    }
}
