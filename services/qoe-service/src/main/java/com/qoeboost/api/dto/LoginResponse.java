package com.qoeboost.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * LoginResponse - returned by POST /auth/login on success.
 *
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer",
 *   "expires_at": "2026-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * The client sends the token back as {@code Authorization: Bearer <access_token>}
 * until expires_at, then logs in again. There is no refresh token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    public static final String TOKEN_TYPE = "bearer";

    @JsonProperty("access_token")
    private String accessToken;

    @Builder.Default
    @JsonProperty("token_type")
    private String tokenType = TOKEN_TYPE;

    @JsonProperty("expires_at")
    private Instant expiresAt;
}
