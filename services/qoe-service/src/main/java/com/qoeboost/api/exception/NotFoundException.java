package com.qoeboost.api.exception;

/**
 * Thrown when a referenced entity does not exist. Surfaced as 404.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
