package com.pulsewatch.core.aggregation;

import com.pulsewatch.core.model.AggregationLevel;

import java.time.Instant;
import java.util.Objects;

/**
 * One scheduled unit of aggregation work: a rule applied to a single bucket.
 *
 * <p>
 * The job id {@code ruleId@bucketStart} is stable, so scheduling the same
 * bucket twice addresses the same job. State transitions are made by the
 * owning {@link AggregationPipeline} only.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationJob {

    private final String ruleId;
    private final Instant bucketStart;
    private final AggregationLevel level;
    private final Instant createdAt;

    private JobStatus status = JobStatus.PENDING;
    private int attempts;
    private Instant nextAttemptAt;
    private String lastError;
    private AggregationResult result;

    AggregationJob(String ruleId, Instant bucketStart, AggregationLevel level, Instant createdAt) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.nextAttemptAt = createdAt;
    }

    static String idOf(String ruleId, Instant bucketStart) {
        return ruleId + "@" + bucketStart;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    synchronized boolean isRunnable(Instant now) {
        return status == JobStatus.PENDING
                || (status == JobStatus.FAILED_RETRYABLE && !nextAttemptAt.isAfter(now));
    }

    synchronized void markRunning() {
        status = JobStatus.RUNNING;
        attempts++;
    }

    synchronized void markCompleted(AggregationResult result) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.lastError = null;
    }

    synchronized void markFailed(String error, boolean terminal, Instant nextAttemptAt) {
        this.status = terminal ? JobStatus.FAILED_TERMINAL : JobStatus.FAILED_RETRYABLE;
        this.lastError = error;
        this.nextAttemptAt = nextAttemptAt;
    }

    /**
     * Hand a job interrupted by shutdown back to the retry path.
     */
    synchronized void markInterrupted(Instant now) {
        if (status == JobStatus.RUNNING) {
            status = JobStatus.FAILED_RETRYABLE;
            lastError = "interrupted by shutdown";
            nextAttemptAt = now;
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return idOf(ruleId, bucketStart);
    }

    public String getRuleId() {
        return ruleId;
    }

    public Instant getBucketStart() {
        return bucketStart;
    }

    public AggregationLevel getLevel() {
        return level;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized AggregationResult getResult() {
        return result;
    }

    @Override
    public synchronized String toString() {
        return "AggregationJob{" +
                "id='" + getId() + '\'' +
                ", status=" + status +
                ", attempts=" + attempts +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}
