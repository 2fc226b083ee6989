package com.qoeboost.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterRequest - payload of POST /auth/register.
 *
 * <pre>
 * {
 *   "username": "alice",
 *   "email": "alice@example.com",
 *   "password": "s3cret-pass",
 *   "provider": "Vodafone"
 * }
 * </pre>
 *
 * Unknown fields are rejected (spring.jackson.deserialization.fail-on-unknown-properties).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    /**
     * Case-sensitive and immutable once registered.
     */
    @NotBlank
    @Size(min = 3, max = 50)
    @Pattern(regexp = "^[A-Za-z0-9._-]+$", message = "may only contain letters, digits, '.', '_' and '-'")
    private String username;

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    /**
     * Never logged or persisted as given; only its BCrypt hash is stored.
     * At most 72 characters here; PasswordHasher also caps the UTF-8 encoding at 72 bytes.
     */
    @NotBlank
    @Size(min = 8, max = 72)
    private String password;

    /** Optional network provider label. */
    @Size(max = 100)
    private String provider;
}
