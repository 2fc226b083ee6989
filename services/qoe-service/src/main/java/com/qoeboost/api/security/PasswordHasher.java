package com.qoeboost.api.security;

import com.qoeboost.api.exception.ValidationFailedException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * PasswordHasher - one-way password hashing with BCrypt.
 *
 * Every hash embeds its own random salt, so hashing the same password twice
 * yields two different strings that both verify. BCrypt compares the
 * recomputed digest without an early exit.
 *
 * BCrypt only reads the first 72 UTF-8 bytes of a password, so longer
 * passwords are refused by {@link #hash} and never verify.
 *
 * {@link #verify} never throws on bad input: a null password or a hash that
 * is not a BCrypt string simply fails verification.
 */
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final BCryptPasswordEncoder encoder;

    public PasswordHasher() {
        this(new BCryptPasswordEncoder());
    }

    PasswordHasher(BCryptPasswordEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * @throws ValidationFailedException if the password exceeds {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    public String hash(String password) {
        if (tooLong(password)) {
            throw new ValidationFailedException("password",
                    "password must not exceed " + MAX_PASSWORD_BYTES + " bytes in UTF-8");
        }
        return encoder.encode(password);
    }

    public boolean verify(String password, String hash) {
        if (password == null || hash == null || hash.isBlank() || tooLong(password)) {
            return false;
        }
        try {
            return encoder.matches(password, hash);
        } catch (IllegalArgumentException e) {
            // Hash with a valid prefix but a corrupt salt
            return false;
        }
    }

    private static boolean tooLong(String password) {
        return password != null
                && password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
