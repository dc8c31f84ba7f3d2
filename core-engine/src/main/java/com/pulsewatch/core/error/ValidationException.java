package com.pulsewatch.core.error;

/**
 * Raised when caller input is malformed (blank identifiers, non-finite values,
 * inconsistent rule definitions).
 *
 * <p>
 * Validation failures are rejected immediately and are never retried.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
