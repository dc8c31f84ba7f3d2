package com.pulsewatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One rollup value for one bucket of one target metric.
 *
 * <p>
 * Identity for upserts is {@link #key()}: target metric, organization, bucket
 * start, level and group tags. Writing the same key twice replaces the stored
 * value.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregatedPoint {

    private final Instant bucketStart;
    private final AggregationLevel level;
    private final double value;
    private final long countContributingPoints;
    private final String organizationId;
    private final String metricName;
    private final Map<String, String> groupTags;

    private AggregatedPoint(Builder b) {
        this.bucketStart = Objects.requireNonNull(b.bucketStart, "bucketStart must not be null");
        this.level = Objects.requireNonNull(b.level, "level must not be null");
        this.value = b.value;
        this.countContributingPoints = b.countContributingPoints;
        this.organizationId = Objects.requireNonNull(b.organizationId, "organizationId must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.groupTags = Collections.unmodifiableMap(new TreeMap<>(b.groupTags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant bucketStart;
        private AggregationLevel level;
        private double value;
        private long countContributingPoints;
        private String organizationId;
        private String metricName;
        private Map<String, String> groupTags = Collections.emptyMap();

        public Builder bucketStart(Instant bucketStart) {
            this.bucketStart = bucketStart;
            return this;
        }

        public Builder level(AggregationLevel level) {
            this.level = level;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder countContributingPoints(long count) {
            this.countContributingPoints = count;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder groupTags(Map<String, String> groupTags) {
            this.groupTags = groupTags != null ? groupTags : Collections.emptyMap();
            return this;
        }

        public AggregatedPoint build() {
            return new AggregatedPoint(this);
        }
    }

    /**
     * Upsert key of this point.
     */
    public Key key() {
        return new Key(metricName, organizationId, bucketStart, level, groupTags);
    }

    public Instant getBucketStart() {
        return bucketStart;
    }

    public AggregationLevel getLevel() {
        return level;
    }

    public double getValue() {
        return value;
    }

    public long getCountContributingPoints() {
        return countContributingPoints;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable, key-sorted group tags
     */
    public Map<String, String> getGroupTags() {
        return groupTags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregatedPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && countContributingPoints == that.countContributingPoints
                && key().equals(that.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(key(), value, countContributingPoints);
    }

    @Override
    public String toString() {
        return "AggregatedPoint{" +
                "metricName='" + metricName + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", level=" + level +
                ", bucketStart=" + bucketStart +
                ", groupTags=" + groupTags +
                ", value=" + value +
                ", count=" + countContributingPoints +
                '}';
    }

    /**
     * Upsert identity of an {@link AggregatedPoint}.
     */
    public static final class Key {
        private final String metricName;
        private final String organizationId;
        private final Instant bucketStart;
        private final AggregationLevel level;
        private final Map<String, String> groupTags;

        Key(String metricName, String organizationId, Instant bucketStart,
                AggregationLevel level, Map<String, String> groupTags) {
            this.metricName = metricName;
            this.organizationId = organizationId;
            this.bucketStart = bucketStart;
            this.level = level;
            this.groupTags = groupTags;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Key that))
                return false;
            return metricName.equals(that.metricName)
                    && organizationId.equals(that.organizationId)
                    && bucketStart.equals(that.bucketStart)
                    && level == that.level
                    && groupTags.equals(that.groupTags);
        }

        @Override
        public int hashCode() {
            return Objects.hash(metricName, organizationId, bucketStart, level, groupTags);
        }

        @Override
        public String toString() {
            return organizationId + ":" + metricName + ":" + level + "@" + bucketStart + groupTags;
        }
    }
}
