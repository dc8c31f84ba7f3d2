package com.pulsewatch.core.error;

/**
 * Raised when an aggregation job attempt fails.
 *
 * @since 1.0.0
 */
public class JobException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String jobId;
    private final int attempt;

    public JobException(String jobId, int attempt, String message, Throwable cause) {
        super("Job " + jobId + " attempt " + attempt + ": " + message, cause);
        this.jobId = jobId;
        this.attempt = attempt;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttempt() {
        return attempt;
    }
}
