package com.qoeboost.api.exception;

/**
 * Authentication failure of any kind: unknown user, wrong password, or an
 * invalid, expired or tampered token.
 *
 * The message is fixed so that callers cannot tell the causes apart.
 * Server-side logs carry the detail instead.
 */
public class UnauthorizedException extends RuntimeException {

    public static final String MESSAGE = "Invalid credentials";

    public UnauthorizedException() {
        super(MESSAGE);
    }
}
