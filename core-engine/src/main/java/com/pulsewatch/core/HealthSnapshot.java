package com.pulsewatch.core;

/**
 * Point-in-time operator view of an {@link AnalyticsCore}.
 *
 * @since 1.0.0
 */
public final class HealthSnapshot {

    private final int trackedMetrics;
    private final long bufferedPoints;
    private final int pendingAggregationJobs;
    private final int activeAlerts;
    private final long ingestedTotal;
    private final int pendingDurableWrites;
    private final boolean durabilityDegraded;
    private final int terminalJobFailures;
    private final long recordedAnomalies;

    HealthSnapshot(int trackedMetrics, long bufferedPoints, int pendingAggregationJobs, int activeAlerts,
            long ingestedTotal, int pendingDurableWrites, boolean durabilityDegraded,
            int terminalJobFailures, long recordedAnomalies) {
        this.trackedMetrics = trackedMetrics;
        this.bufferedPoints = bufferedPoints;
        this.pendingAggregationJobs = pendingAggregationJobs;
        this.activeAlerts = activeAlerts;
        this.ingestedTotal = ingestedTotal;
        this.pendingDurableWrites = pendingDurableWrites;
        this.durabilityDegraded = durabilityDegraded;
        this.terminalJobFailures = terminalJobFailures;
        this.recordedAnomalies = recordedAnomalies;
    }

    public int getTrackedMetrics() {
        return trackedMetrics;
    }

    public long getBufferedPoints() {
        return bufferedPoints;
    }

    public int getPendingAggregationJobs() {
        return pendingAggregationJobs;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public long getIngestedTotal() {
        return ingestedTotal;
    }

    public int getPendingDurableWrites() {
        return pendingDurableWrites;
    }

    public boolean isDurabilityDegraded() {
        return durabilityDegraded;
    }

    public int getTerminalJobFailures() {
        return terminalJobFailures;
    }

    public long getRecordedAnomalies() {
        return recordedAnomalies;
    }

    @Override
    public String toString() {
        return "HealthSnapshot{trackedMetrics=" + trackedMetrics
                + ", bufferedPoints=" + bufferedPoints
                + ", pendingAggregationJobs=" + pendingAggregationJobs
                + ", activeAlerts=" + activeAlerts
                + ", ingestedTotal=" + ingestedTotal
                + ", pendingDurableWrites=" + pendingDurableWrites
                + ", durabilityDegraded=" + durabilityDegraded
                + ", terminalJobFailures=" + terminalJobFailures
                + ", recordedAnomalies=" + recordedAnomalies + '}';
    }
}
