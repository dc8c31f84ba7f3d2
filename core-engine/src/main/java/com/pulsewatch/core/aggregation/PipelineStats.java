package com.pulsewatch.core.aggregation;

/**
 * Point-in-time counters of the {@link AggregationPipeline}.
 *
 * @since 1.0.0
 */
public final class PipelineStats {

    private final int activeRules;
    private final int pending;
    private final int running;
    private final int completed;
    private final int failedRetryable;
    private final int failedTerminal;
    private final long pointsProcessed;

    PipelineStats(int activeRules, int pending, int running, int completed,
            int failedRetryable, int failedTerminal, long pointsProcessed) {
        this.activeRules = activeRules;
        this.pending = pending;
        this.running = running;
        this.completed = completed;
        this.failedRetryable = failedRetryable;
        this.failedTerminal = failedTerminal;
        this.pointsProcessed = pointsProcessed;
    }

    public int getActiveRules() {
        return activeRules;
    }

    public int getPending() {
        return pending;
    }

    public int getRunning() {
        return running;
    }

    public int getCompleted() {
        return completed;
    }

    public int getFailedRetryable() {
        return failedRetryable;
    }

    public int getFailedTerminal() {
        return failedTerminal;
    }

    /** Raw points read by completed jobs since start. */
    public long getPointsProcessed() {
        return pointsProcessed;
    }

    @Override
    public String toString() {
        return "PipelineStats{" +
                "activeRules=" + activeRules +
                ", pending=" + pending +
                ", running=" + running +
                ", completed=" + completed +
                ", failedRetryable=" + failedRetryable +
                ", failedTerminal=" + failedTerminal +
                ", pointsProcessed=" + pointsProcessed +
                '}';
    }
}
