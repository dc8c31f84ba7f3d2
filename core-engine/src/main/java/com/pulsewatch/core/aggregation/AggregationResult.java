package com.pulsewatch.core.aggregation;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of aggregating one bucket for one rule.
 *
 * @since 1.0.0
 */
public final class AggregationResult {

    private final String ruleId;
    private final Instant bucketStart;
    private final int pointsRead;
    private final int pointsWritten;

    public AggregationResult(String ruleId, Instant bucketStart, int pointsRead, int pointsWritten) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart must not be null");
        this.pointsRead = pointsRead;
        this.pointsWritten = pointsWritten;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Instant getBucketStart() {
        return bucketStart;
    }

    /** Raw points read from the source series. */
    public int getPointsRead() {
        return pointsRead;
    }

    /** Aggregated points upserted, one per tag group with data. */
    public int getPointsWritten() {
        return pointsWritten;
    }

    @Override
    public String toString() {
        return "AggregationResult{" +
                "ruleId='" + ruleId + '\'' +
                ", bucketStart=" + bucketStart +
                ", pointsRead=" + pointsRead +
                ", pointsWritten=" + pointsWritten +
                '}';
    }
}
