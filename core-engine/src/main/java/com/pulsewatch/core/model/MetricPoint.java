package com.pulsewatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single time-stamped numeric observation for one metric of one
 * organization.
 *
 * <p>
 * Instances are immutable. Tags are carried for query filtering and grouping
 * only; the live-window identity of a point is
 * {@code (organizationId, metricName)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code organizationId} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricPoint {

    private final Instant timestamp;
    private final String metricName;
    private final String organizationId;
    private final double value;
    private final Map<String, String> tags;
    private final Map<String, Object> metadata;

    private MetricPoint(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.value = builder.value;
        this.tags = builder.tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
        this.metadata = builder.metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricPoint} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private String metricName;
        private String organizationId;
        private double value;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
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

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public MetricPoint build() {
            return new MetricPoint(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return unmodifiable tag map, never {@code null}
     */
    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * @return unmodifiable metadata map, never {@code null}
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Check whether this point carries every key/value pair of the filter.
     *
     * @param filter tag filter; {@code null} or empty matches everything
     * @return {@code true} if all filter entries are present with equal values
     */
    public boolean matchesTags(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> e : filter.entrySet()) {
            if (!Objects.equals(tags.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && metricName.equals(that.metricName)
                && organizationId.equals(that.organizationId)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, metricName, organizationId, value, tags);
    }

    @Override
    public String toString() {
        return "MetricPoint{" +
                "timestamp=" + timestamp +
                ", metricName='" + metricName + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", value=" + value +
                ", tags=" + tags +
                '}';
    }
}
