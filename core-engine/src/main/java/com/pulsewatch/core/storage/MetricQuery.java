package com.pulsewatch.core.storage;

import com.pulsewatch.core.model.AggregationFunction;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of a {@link TimeSeriesStore#query(MetricQuery)} call.
 *
 * <p>
 * {@code metricName} and {@code organizationId} are required. The time range
 * is half-open {@code [start, end)}; a {@code null} bound is unbounded on that
 * side. Setting {@code aggregation} and/or {@code interval} switches the query
 * from raw points to bucketed values.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricQuery {

    private final String metricName;
    private final String organizationId;
    private final Instant start;
    private final Instant end;
    private final Map<String, String> tags;
    private final AggregationFunction aggregation;
    private final Duration interval;
    private final double percentile;
    private final int limit;

    private MetricQuery(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.start = builder.start;
        this.end = builder.end;
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start: " + start + " > " + end);
        }
        this.tags = builder.tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
        this.aggregation = builder.aggregation;
        if (builder.interval != null && (builder.interval.isZero() || builder.interval.isNegative())) {
            throw new IllegalArgumentException("interval must be positive, got: " + builder.interval);
        }
        this.interval = builder.interval;
        this.percentile = builder.percentile;
        if (builder.limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + builder.limit);
        }
        this.limit = builder.limit;
    }

    public static Builder builder(String metricName, String organizationId) {
        return new Builder().metricName(metricName).organizationId(organizationId);
    }

    public static class Builder {
        private String metricName;
        private String organizationId;
        private Instant start;
        private Instant end;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private AggregationFunction aggregation;
        private Duration interval;
        private double percentile = 50.0;
        private int limit;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Builder range(Instant start, Instant end) {
            return start(start).end(end);
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                this.tags.putAll(tags);
            }
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder aggregation(AggregationFunction aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder percentile(double percentile) {
            this.percentile = percentile;
            return this;
        }

        /** Keep only the most recent {@code limit} results; {@code 0} means no limit. */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public MetricQuery build() {
            return new MetricQuery(this);
        }
    }

    public boolean isBucketed() {
        return aggregation != null || interval != null;
    }

    public boolean contains(Instant timestamp) {
        return (start == null || !timestamp.isBefore(start))
                && (end == null || timestamp.isBefore(end));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public AggregationFunction getAggregation() {
        return aggregation;
    }

    public Duration getInterval() {
        return interval;
    }

    public double getPercentile() {
        return percentile;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "MetricQuery{" +
                "metricName='" + metricName + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", tags=" + tags +
                ", aggregation=" + aggregation +
                ", interval=" + interval +
                ", limit=" + limit +
                '}';
    }
}
