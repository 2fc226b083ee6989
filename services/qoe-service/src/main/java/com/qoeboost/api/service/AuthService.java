package com.qoeboost.api.service;

import com.qoeboost.api.entity.User;
import com.qoeboost.api.exception.UnauthorizedException;
import com.qoeboost.api.security.IssuedToken;
import com.qoeboost.api.security.JwtUtil;
import com.qoeboost.api.security.PasswordHasher;
import com.qoeboost.api.storage.PersistenceGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * AuthService - registration, login and bearer token authentication.
 *
 * Key Responsibilities:
 * - Register users with a BCrypt password hash
 * - Exchange username/password for a signed bearer token
 * - Resolve a bearer token back to a live, active user
 *
 * Security Considerations:
 * - Unknown username and wrong password raise the same UnauthorizedException,
 *   and an unknown username still pays for one BCrypt verification so the
 *   two cases take comparable time
 * - A cryptographically valid token is refused once its user is gone or
 *   deactivated
 * - Passwords, hashes and tokens never reach the log
 *
 * Uniqueness of username and email is enforced atomically by the
 * PersistenceGateway, not by a lookup here.
 *
 * @see JwtUtil for token operations
 * @see PersistenceGateway for storage
 */
@Slf4j
@Service
public class AuthService {

    private static final String BEARER_PREFIX = "bearer ";

    private final PersistenceGateway persistenceGateway;
    private final PasswordHasher passwordHasher;
    private final JwtUtil jwtUtil;

    /** Verified against when the username is unknown, to even out timing. */
    private final String dummyHash;

    private final Counter usersRegistered;
    private final Counter loginSucceeded;
    private final Counter loginFailed;

    public AuthService(
            PersistenceGateway persistenceGateway,
            PasswordHasher passwordHasher,
            JwtUtil jwtUtil,
            MeterRegistry meterRegistry) {
        this.persistenceGateway = persistenceGateway;
        this.passwordHasher = passwordHasher;
        this.jwtUtil = jwtUtil;
        this.dummyHash = passwordHasher.hash(UUID.randomUUID().toString());
        this.usersRegistered = Counter.builder("qoe_users_registered_total")
                .description("Total number of users registered")
                .register(meterRegistry);
        this.loginSucceeded = Counter.builder("qoe_login_attempts_total")
                .description("Total number of login attempts")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.loginFailed = Counter.builder("qoe_login_attempts_total")
                .description("Total number of login attempts")
                .tag("outcome", "failure")
                .register(meterRegistry);
    }

    /**
     * Create a new account.
     *
     * @param provider optional network provider label, may be null
     * @return the stored user
     * @throws com.qoeboost.api.exception.ConflictException if username or email is taken
     */
    public User register(String username, String email, String password, String provider, Instant now) {
        log.info("Registering new user: username={}", username);

        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHasher.hash(password))
                .provider(provider)
                .createdAt(now)
                .active(true)
                .build();

        User saved = persistenceGateway.createUser(user);
        usersRegistered.increment();
        log.info("User registered: id={}, username={}", saved.getId(), saved.getUsername());
        return saved;
    }

    /**
     * Exchange credentials for a bearer token bound to the username.
     *
     * @throws UnauthorizedException for an unknown user, an inactive user or a wrong password
     */
    public IssuedToken login(String username, String password, Instant now) {
        User user = persistenceGateway.findUserByUsername(username).orElse(null);

        boolean verified;
        if (user == null) {
            passwordHasher.verify(password, dummyHash);
            verified = false;
        } else {
            verified = passwordHasher.verify(password, user.getPasswordHash()) && user.isActive();
        }

        if (!verified) {
            loginFailed.increment();
            log.warn("Login rejected: username={}", username);
            throw new UnauthorizedException();
        }

        IssuedToken token = jwtUtil.issue(username, now);
        loginSucceeded.increment();
        log.info("Login successful: id={}, expiresAt={}", user.getId(), token.getExpiresAt());
        return token;
    }

    /**
     * Resolve a bearer token to the user it was issued for.
     *
     * @throws UnauthorizedException if the token is invalid at {@code now}, or
     *                               its subject no longer exists or is inactive
     */
    public User authenticate(String token, Instant now) {
        return jwtUtil.validate(token, now)
                .flatMap(persistenceGateway::findUserByUsername)
                .filter(User::isActive)
                .orElseThrow(() -> {
                    log.debug("Bearer token did not resolve to an active user");
                    return new UnauthorizedException();
                });
    }

    /**
     * Optional authentication from an Authorization header value.
     *
     * @return empty when no header was sent; the user when the header carries
     *         a valid bearer token
     * @throws UnauthorizedException when a header is present but is not a
     *                               valid bearer token
     */
    public Optional<User> resolveBearer(String authorizationHeader, Instant now) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(authenticate(extractBearer(authorizationHeader), now));
    }

    /**
     * Mandatory authentication from an Authorization header value.
     */
    public User requireBearer(String authorizationHeader, Instant now) {
        return resolveBearer(authorizationHeader, now).orElseThrow(UnauthorizedException::new);
    }

    private static String extractBearer(String authorizationHeader) {
        if (authorizationHeader.length() <= BEARER_PREFIX.length()
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException();
        }
        return authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    }
}
