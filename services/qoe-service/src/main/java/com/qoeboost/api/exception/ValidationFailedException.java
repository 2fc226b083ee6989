package com.qoeboost.api.exception;

import lombok.Getter;

/**
 * Malformed or missing input. Carries the name of the offending field so the
 * client error can point at it.
 */
@Getter
public class ValidationFailedException extends RuntimeException {

    private final String field;

    public ValidationFailedException(String field, String message) {
        super(message);
        this.field = field;
    }
}
