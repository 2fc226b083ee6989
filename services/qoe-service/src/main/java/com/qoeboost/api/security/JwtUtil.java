package com.qoeboost.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;

/**
 * JwtUtil - issues and validates the bearer tokens of the QoE Boost API.
 *
 * JWT Structure (RFC 7519):
 * - Header: HS256
 * - Payload: sub (username), iat, exp
 * - Signature: HMAC-SHA256 with the process-wide secret
 *
 * Configuration (application.yml):
 * - jwt.secret: HMAC signing key, at least 32 bytes
 * - jwt.expiration: token lifetime in milliseconds (default 1800000, 30 minutes)
 *
 * Tokens are self-contained: there is no session table and no revocation
 * list. A token is valid iff its signature checks out and the validation
 * time is strictly before exp.
 *
 * JWT timestamps have one-second precision, so the issue time is truncated
 * to whole seconds before exp is computed. That keeps iat and exp exact
 * after the round trip through the token.
 */
@Slf4j
@Component
public class JwtUtil {

    private final Key signingKey;
    private final Duration expiration;

    public JwtUtil(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.expiration:1800000}") long expirationMillis) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = Duration.ofMillis(expirationMillis);
        if (expiration.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("jwt.expiration must be at least one second");
        }
    }

    public Duration getExpiration() {
        return expiration;
    }

    /**
     * Sign a token asserting {@code subject}.
     *
     * JWT dates carry whole seconds, so the issue time is {@code now} truncated
     * to the second and the expiry is that truncated time plus the configured
     * lifetime. A token can therefore expire up to 999 ms before
     * {@code now + expiration}.
     *
     * @param subject username the token is bound to
     * @param now     issue time
     * @return signed token with its issue and expiry instants
     */
    public IssuedToken issue(String subject, Instant now) {
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(expiration);
        String token = Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, issuedAt, expiresAt);
    }

    /**
     * Check a token at time {@code now}.
     *
     * Signature mismatch, malformed input and expiry all produce an empty
     * result; the reason is only logged at debug level.
     *
     * @return the subject, or empty if the token is not valid at {@code now}
     */
    public Optional<String> validate(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(now))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            Date expiresAt = claims.getExpiration();
            // The parser accepts now == exp; the token is already expired at that instant
            if (expiresAt == null || !now.isBefore(expiresAt.toInstant())) {
                return Optional.empty();
            }
            return Optional.ofNullable(claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
