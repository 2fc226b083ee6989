package com.qoeboost.api.exception;

/**
 * Thrown when a write would break a uniqueness rule (username or email
 * already registered). Surfaced as 400 with error code "conflict".
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
