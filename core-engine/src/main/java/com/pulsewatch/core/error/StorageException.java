package com.pulsewatch.core.error;

/**
 * Raised by a {@link com.pulsewatch.core.storage.TimeSeriesStore} when the
 * backend is unreachable or times out.
 *
 * <p>
 * Callers may retry with backoff; see {@link com.pulsewatch.core.util.RetryPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
