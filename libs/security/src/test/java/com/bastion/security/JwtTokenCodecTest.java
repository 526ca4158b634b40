package com.bastion.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bastion.security.testing.MutableClock;
import com.bastion.security.testing.TestTenants;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JwtTokenCodec")
class JwtTokenCodecTest {

    private static final String SECRET = "change-me";

    private MutableClock clock;
    private JwtTokenCodec codec;
    private TenantContext acme;
    private TenantContext beta;
    private Identity alice;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-15T10:00:00Z");
        codec = new JwtTokenCodec(SECRET, Duration.ofMinutes(30), null, clock);
        acme = TestTenants.acme();
        beta = TestTenants.beta();
        alice = TestTenants.identity(acme, "alice", Role.MEMBER);
    }

    @Nested
    @DisplayName("issue()")
    class Issue {

        @Test
        @DisplayName("binds the token to the identity's tenant with the configured validity")
        void issuesBoundToken() {
            AuthToken token = codec.issue(alice, acme);

            assertThat(token.subjectId()).isEqualTo("alice");
            assertThat(token.tenantId()).isEqualTo(TestTenants.ACME_ID);
            assertThat(token.role()).isEqualTo(Role.MEMBER);
            assertThat(token.issuedAt()).isEqualTo(clock.instant());
            assertThat(token.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
            assertThat(token.encoded()).contains(".");
        }

        @Test
        @DisplayName("refuses to issue for an identity of another tenant")
        void rejectsForeignIdentity() {
            assertThatThrownBy(() -> codec.issue(alice, beta))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("does not expose the encoded token through toString")
        void toStringRedacted() {
            AuthToken token = codec.issue(alice, acme);
            assertThat(token.toString()).doesNotContain(token.encoded());
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("returns the identity for a valid token on its own tenant")
        void validToken() {
            AuthToken token = codec.issue(alice, acme);

            Outcome<Identity> outcome = codec.verify(token.encoded(), acme);

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.value()).isEqualTo(alice);
        }

        @Test
        @DisplayName("rejects a validly signed token presented to another tenant")
        void tenantMismatch() {
            AuthToken token = codec.issue(alice, acme);

            Outcome<Identity> outcome = codec.verify(token.encoded(), beta);

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.error().code()).isEqualTo(ErrorCode.TENANT_MISMATCH);
        }

        @Test
        @DisplayName("expires exactly at the expiry instant")
        void expiry() {
            AuthToken token = codec.issue(alice, acme);

            clock.advance(Duration.ofMinutes(30).minusSeconds(1));
            assertThat(codec.verify(token.encoded(), acme).isSuccess()).isTrue();

            clock.advance(Duration.ofSeconds(1));
            assertThat(codec.verify(token.encoded(), acme).error().code()).isEqualTo(ErrorCode.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("reports expiry before tenant mismatch")
        void expiryBeforeMismatch() {
            AuthToken token = codec.issue(alice, acme);
            clock.advance(Duration.ofHours(1));

            assertThat(codec.verify(token.encoded(), beta).error().code()).isEqualTo(ErrorCode.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("rejects a token signed with another secret")
        void wrongSecret() {
            JwtTokenCodec other = new JwtTokenCodec("another-secret", Duration.ofMinutes(30), null, clock);
            AuthToken token = other.issue(alice, acme);

            assertThat(codec.verify(token.encoded(), acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("rejects a tampered payload")
        void tampered() {
            String[] parts = codec.issue(alice, acme).encoded().split("\\.");
            AuthToken adminToken = codec.issue(TestTenants.identity(acme, "alice", Role.ADMIN), acme);
            String forged = parts[0] + "." + adminToken.encoded().split("\\.")[1] + "." + parts[2];

            assertThat(codec.verify(forged, acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("rejects missing, blank and malformed tokens")
        void malformed() {
            assertThat(codec.verify(null, acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
            assertThat(codec.verify("  ", acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
            assertThat(codec.verify("not-a-jwt", acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("rejects a correctly signed token with an unknown role")
        void unknownRole() throws Exception {
            String raw = sign(new JWTClaimsSet.Builder()
                    .subject("alice")
                    .claim("tenant_id", TestTenants.ACME_ID)
                    .claim("role", "owner")
                    .issueTime(Date.from(clock.instant()))
                    .expirationTime(Date.from(clock.instant().plusSeconds(60)))
                    .build());

            assertThat(codec.verify(raw, acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("rejects a correctly signed token without a tenant claim")
        void missingTenantClaim() throws Exception {
            String raw = sign(new JWTClaimsSet.Builder()
                    .subject("alice")
                    .claim("role", "admin")
                    .expirationTime(Date.from(clock.instant().plusSeconds(60)))
                    .build());

            assertThat(codec.verify(raw, acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("checks the issuer when one is configured")
        void issuer() {
            JwtTokenCodec withIssuer = new JwtTokenCodec(SECRET, Duration.ofMinutes(30), "bastion", clock);
            AuthToken foreign = codec.issue(alice, acme);

            assertThat(withIssuer.verify(withIssuer.issue(alice, acme).encoded(), acme).isSuccess()).isTrue();
            assertThat(withIssuer.verify(foreign.encoded(), acme).error().code()).isEqualTo(ErrorCode.TOKEN_INVALID);
        }
    }

    @Test
    @DisplayName("rejects a blank secret at construction")
    void blankSecret() {
        assertThatThrownBy(() -> new JwtTokenCodec(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String sign(JWTClaimsSet claims) throws Exception {
        byte[] key = MessageDigest.getInstance("SHA-256").digest(SECRET.getBytes(StandardCharsets.UTF_8));
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(key));
        return jwt.serialize();
    }
}
