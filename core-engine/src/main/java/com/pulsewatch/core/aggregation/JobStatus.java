package com.pulsewatch.core.aggregation;

/**
 * Lifecycle of an {@link AggregationJob}.
 *
 * <pre>
 * PENDING -&gt; RUNNING -&gt; COMPLETED
 *                    -&gt; FAILED_RETRYABLE -&gt; RUNNING ...
 *                    -&gt; FAILED_TERMINAL
 * </pre>
 *
 * @since 1.0.0
 */
public enum JobStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED_RETRYABLE,
    FAILED_TERMINAL;

    public boolean isDone() {
        return this == COMPLETED || this == FAILED_TERMINAL;
    }
}
