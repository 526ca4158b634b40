package com.bastion.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;

/**
 * HS256 JWT implementation of {@link TokenCodec} backed by Nimbus JOSE+JWT.
 * <p>
 * Tokens carry {@code sub}, {@code tenant_id}, {@code role}, {@code iat} and {@code exp}, plus
 * {@code iss} when an issuer is configured. The shared secret may have any length; it is
 * digested with SHA-256 into the 256-bit key HS256 requires.
 */
public final class JwtTokenCodec implements TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenCodec.class);

    public static final Duration DEFAULT_VALIDITY = Duration.ofMinutes(30);

    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_ROLE = "role";

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Duration validity;
    private final String issuer;
    private final Clock clock;

    public JwtTokenCodec(String secret) {
        this(secret, DEFAULT_VALIDITY, null, Clock.systemUTC());
    }

    /**
     * @param secret   shared signing secret, must not be blank
     * @param validity lifetime of issued tokens, must be positive
     * @param issuer   value for the {@code iss} claim, or null to neither set nor check it
     * @param clock    time source for issue and expiry checks
     */
    public JwtTokenCodec(String secret, Duration validity, String issuer, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Token secret must not be null or blank");
        }
        if (validity == null || validity.isZero() || validity.isNegative()) {
            throw new IllegalArgumentException("Token validity must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        byte[] key = deriveKey(secret);
        try {
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to initialise HS256 key", e);
        }
        this.validity = validity;
        this.issuer = (issuer == null || issuer.isBlank()) ? null : issuer;
        this.clock = clock;
    }

    @Override
    public AuthToken issue(Identity identity, TenantContext tenant) {
        if (!identity.tenantId().equals(tenant.tenantId())) {
            throw new IllegalArgumentException("Identity '%s' belongs to tenant '%s', not '%s'"
                    .formatted(identity.subjectId(), identity.tenantId(), tenant.tenantId()));
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(validity);

        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
                .subject(identity.subjectId())
                .claim(CLAIM_TENANT_ID, identity.tenantId())
                .claim(CLAIM_ROLE, identity.role().value())
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt));
        if (issuer != null) {
            claims.issuer(issuer);
        }

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
        return new AuthToken(identity.subjectId(), identity.tenantId(), identity.role(),
                issuedAt, expiresAt, jwt.serialize());
    }

    @Override
    public Outcome<Identity> verify(String rawToken, TenantContext expectedTenant) {
        if (rawToken == null || rawToken.isBlank()) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Missing bearer token");
        }

        JWTClaimsSet claims;
        try {
            SignedJWT jwt = SignedJWT.parse(rawToken.strip());
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
                return Outcome.failure(ErrorCode.TOKEN_INVALID, "Unsupported token algorithm");
            }
            if (!jwt.verify(verifier)) {
                return Outcome.failure(ErrorCode.TOKEN_INVALID, "Token signature validation failed");
            }
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            log.debug("Token parsing failed: {}", e.getMessage());
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Malformed token");
        } catch (JOSEException e) {
            log.debug("Token signature check failed: {}", e.getMessage());
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Token signature validation failed");
        }

        Optional<Identity> identity = readIdentity(claims);
        if (identity.isEmpty()) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Token is missing required claims");
        }
        if (issuer != null && !issuer.equals(claims.getIssuer())) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Token issuer mismatch");
        }

        Date expiration = claims.getExpirationTime();
        if (expiration == null) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID, "Token has no expiry");
        }
        if (!clock.instant().isBefore(expiration.toInstant())) {
            return Outcome.failure(ErrorCode.TOKEN_EXPIRED, "Token expired");
        }

        if (!identity.get().tenantId().equals(expectedTenant.tenantId())) {
            return Outcome.failure(ErrorCode.TENANT_MISMATCH,
                    "Token is not valid for tenant '%s'".formatted(expectedTenant.slug()));
        }
        return Outcome.success(identity.get());
    }

    public Duration validity() {
        return validity;
    }

    private static Optional<Identity> readIdentity(JWTClaimsSet claims) {
        try {
            String subject = claims.getSubject();
            String tenantId = claims.getStringClaim(CLAIM_TENANT_ID);
            String roleValue = claims.getStringClaim(CLAIM_ROLE);
            if (subject == null || subject.isBlank() || tenantId == null || tenantId.isBlank()) {
                return Optional.empty();
            }
            return Role.fromString(roleValue).map(role -> new Identity(subject, tenantId, role));
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    private static byte[] deriveKey(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
