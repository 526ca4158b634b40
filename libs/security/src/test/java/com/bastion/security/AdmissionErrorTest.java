package com.bastion.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AdmissionError and Outcome")
class AdmissionErrorTest {

    @Nested
    @DisplayName("retry-after rounding")
    class RetryAfter {

        @Test
        @DisplayName("rounds partial seconds up")
        void roundsUp() {
            assertThat(AdmissionError.rateLimited(Duration.ofMillis(1200)).retryAfterSeconds()).isEqualTo(2);
            assertThat(AdmissionError.rateLimited(Duration.ofSeconds(3)).retryAfterSeconds()).isEqualTo(3);
        }

        @Test
        @DisplayName("never reports less than one second")
        void minimumOne() {
            assertThat(AdmissionError.rateLimited(Duration.ZERO).retryAfterSeconds()).isEqualTo(1);
            assertThat(AdmissionError.rateLimited(Duration.ofMillis(10)).retryAfterSeconds()).isEqualTo(1);
        }

        @Test
        @DisplayName("is only allowed on rate-limit errors")
        void onlyForRateLimit() {
            assertThatThrownBy(() -> new AdmissionError(ErrorCode.FORBIDDEN, "x", null, Duration.ofSeconds(1)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(AdmissionError.of(ErrorCode.FORBIDDEN, "x").retryAfterSeconds()).isZero();
        }
    }

    @Test
    @DisplayName("blank detail falls back to the code title")
    void defaultDetail() {
        assertThat(AdmissionError.of(ErrorCode.TENANT_NOT_FOUND, " ").detail()).isEqualTo("Tenant not found");
    }

    @Test
    @DisplayName("status mapping matches the transport contract")
    void statusMapping() {
        assertThat(ErrorCode.TENANT_NOT_FOUND.httpStatus()).isEqualTo(404);
        assertThat(ErrorCode.TENANT_INACTIVE.httpStatus()).isEqualTo(403);
        assertThat(ErrorCode.TOKEN_INVALID.httpStatus()).isEqualTo(401);
        assertThat(ErrorCode.TOKEN_EXPIRED.httpStatus()).isEqualTo(401);
        assertThat(ErrorCode.TENANT_MISMATCH.httpStatus()).isEqualTo(403);
        assertThat(ErrorCode.FORBIDDEN.httpStatus()).isEqualTo(403);
        assertThat(ErrorCode.LAST_ADMIN_VIOLATION.httpStatus()).isEqualTo(409);
        assertThat(ErrorCode.RATE_LIMIT_EXCEEDED.httpStatus()).isEqualTo(429);
    }

    @Nested
    @DisplayName("Outcome")
    class Outcomes {

        @Test
        @DisplayName("flatMap chains successes")
        void chainsSuccess() {
            Outcome<Integer> result = Outcome.success("21").flatMap(s -> Outcome.success(Integer.parseInt(s) * 2));
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.value()).isEqualTo(42);
        }

        @Test
        @DisplayName("flatMap short-circuits on the first failure")
        void shortCircuits() {
            Outcome<String> failed = Outcome.failure(ErrorCode.TENANT_NOT_FOUND, "none");
            Outcome<String> result = failed.flatMap(s -> {
                throw new AssertionError("must not run");
            });
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().code()).isEqualTo(ErrorCode.TENANT_NOT_FOUND);
            assertThatThrownBy(result::value).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("map transforms only successes")
        void mapsValue() {
            assertThat(Outcome.success(2).map(i -> i + 1).value()).isEqualTo(3);
            assertThatThrownBy(() -> Outcome.success(1).error()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("map carries the failure over to the new value type")
        void mapKeepsFailure() {
            AdmissionError error = AdmissionError.of(ErrorCode.FORBIDDEN, "no");
            Outcome<Integer> failed = Outcome.failure(error);

            Outcome<String> mapped = failed.map(i -> "never " + i);

            assertThat(mapped.isSuccess()).isFalse();
            assertThat(mapped.error()).isEqualTo(error);
            assertThat(mapped).isEqualTo(Outcome.<String>failure(error));
        }
    }
}
