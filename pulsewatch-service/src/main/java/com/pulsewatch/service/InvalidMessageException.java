package com.pulsewatch.service;

/**
 * Thrown when a metric message cannot be parsed or lacks a required field.
 *
 * @since 1.0.0
 */
public class InvalidMessageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
