package com.qoeboost.api.controller;

import com.qoeboost.api.dto.LoginRequest;
import com.qoeboost.api.dto.LoginResponse;
import com.qoeboost.api.dto.RegisterRequest;
import com.qoeboost.api.dto.UserResponse;
import com.qoeboost.api.entity.User;
import com.qoeboost.api.security.IssuedToken;
import com.qoeboost.api.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * AuthController - REST API endpoints for authentication.
 *
 * Endpoints:
 * - POST /auth/register - Create an account
 * - POST /auth/login    - Exchange username/password for a bearer token
 * - GET  /auth/me       - Current user from the bearer token
 *
 * Security Model:
 * - Stateless: the token is the session, valid for 30 minutes
 * - No logout endpoint: tokens are not revocable and simply expire
 *
 * Error Handling (see ApiExceptionHandler):
 * - 400 Bad Request: invalid input, or username/email already registered
 * - 401 Unauthorized: any credential or token failure, with one fixed message
 *
 * @see AuthService for business logic
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final Clock clock;

    /**
     * Register a new user.
     *
     * @return 201 with the created user; the password hash is never included
     */
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = authService.register(
                request.getUsername(),
                request.getEmail(),
                request.getPassword(),
                request.getProvider(),
                clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * Authenticate and return a bearer token.
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        IssuedToken token = authService.login(request.getUsername(), request.getPassword(), clock.instant());
        return ResponseEntity.ok(LoginResponse.builder()
                .accessToken(token.getToken())
                .expiresAt(token.getExpiresAt())
                .build());
    }

    /**
     * The user the bearer token was issued to.
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        User user = authService.requireBearer(authorization, clock.instant());
        return ResponseEntity.ok(UserResponse.from(user));
    }
}
