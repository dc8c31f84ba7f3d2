package com.pulsewatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A value the anomaly engine judged unusual for its metric.
 *
 * <p>
 * Instances are immutable. The only state change an anomaly ever goes through
 * is resolution by an operator, expressed as a new instance returned from
 * {@link #withResolution(String, String, Instant)}. Anomalies are never
 * deleted.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * {@link #getId()} identifies the stored record. {@link #dedupKey()} identifies
 * the observation: two detections of the same point of the same series share a
 * key and must not produce two records. Anomalies found in rollups carry the
 * rollup's group tags, and each tag group is its own series.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private final String id;
    private final Instant timestamp;
    private final Instant detectedAt;
    private final String metricName;
    private final String organizationId;
    private final Map<String, String> tags;
    private final double value;
    private final double expectedValue;
    private final double deviationScore;
    private final AnomalyType anomalyType;
    private final Severity severity;
    private final double confidence;
    private final DetectionMethod method;
    private final List<DetectorKind> detectors;
    private final String explanation;
    private final boolean resolved;
    private final Instant resolvedAt;
    private final String resolvedBy;
    private final String resolutionNote;

    private Anomaly(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.detectedAt = builder.detectedAt != null ? builder.detectedAt : builder.timestamp;
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.tags = builder.tags == null || builder.tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(builder.tags));
        this.value = builder.value;
        this.expectedValue = builder.expectedValue;
        this.deviationScore = builder.deviationScore;
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.detectors = builder.detectors != null ? List.copyOf(builder.detectors) : List.of();
        this.explanation = builder.explanation;
        this.resolved = builder.resolved;
        this.resolvedAt = builder.resolvedAt;
        this.resolvedBy = builder.resolvedBy;
        this.resolutionNote = builder.resolutionNote;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this anomaly into a builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .timestamp(timestamp)
                .detectedAt(detectedAt)
                .metricName(metricName)
                .organizationId(organizationId)
                .tags(tags)
                .value(value)
                .expectedValue(expectedValue)
                .deviationScore(deviationScore)
                .anomalyType(anomalyType)
                .severity(severity)
                .confidence(confidence)
                .method(method)
                .detectors(detectors)
                .explanation(explanation)
                .resolved(resolved)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy)
                .resolutionNote(resolutionNote);
    }

    public static class Builder {
        private String id;
        private Instant timestamp;
        private Instant detectedAt;
        private String metricName;
        private String organizationId;
        private Map<String, String> tags;
        private double value;
        private double expectedValue;
        private double deviationScore;
        private AnomalyType anomalyType = AnomalyType.POINT;
        private Severity severity = Severity.LOW;
        private double confidence;
        private DetectionMethod method;
        private List<DetectorKind> detectors;
        private String explanation;
        private boolean resolved;
        private Instant resolvedAt;
        private String resolvedBy;
        private String resolutionNote;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
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

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviationScore(double deviationScore) {
            this.deviationScore = deviationScore;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder detectors(List<DetectorKind> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder resolved(boolean resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolutionNote(String resolutionNote) {
            this.resolutionNote = resolutionNote;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Behaviour
    // ---------------------------------------------------------------

    /**
     * Return a resolved copy of this anomaly.
     *
     * @param note       free-text resolution note, may be {@code null}
     * @param resolvedBy operator identity, may be {@code null}
     * @param at         resolution time
     * @return a new instance with {@code resolved = true}
     */
    public Anomaly withResolution(String note, String resolvedBy, Instant at) {
        return toBuilder()
                .resolved(true)
                .resolutionNote(note)
                .resolvedBy(resolvedBy)
                .resolvedAt(Objects.requireNonNull(at, "at must not be null"))
                .build();
    }

    /**
     * Key under which repeated detections of the same observation collapse.
     */
    public String dedupKey() {
        return dedupKey(organizationId, metricName, tags, timestamp);
    }

    public static String dedupKey(String organizationId, String metricName, Instant timestamp) {
        return dedupKey(organizationId, metricName, Map.of(), timestamp);
    }

    /**
     * @param tags group tags of the series, empty for an ungrouped series
     */
    public static String dedupKey(String organizationId, String metricName, Map<String, String> tags,
            Instant timestamp) {
        String key = organizationId + '\u0000' + metricName + '\u0000' + timestamp.toEpochMilli();
        return tags.isEmpty() ? key : key + '\u0000' + new TreeMap<>(tags);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    /**
     * @return group tags of the series the anomaly was found in, empty for an
     *         ungrouped series; never {@code null}
     */
    public Map<String, String> getTags() {
        return tags;
    }

    public double getValue() {
        return value;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getDeviationScore() {
        return deviationScore;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    /**
     * @return the detectors whose vote confirmed this anomaly, never {@code null}
     */
    public List<DetectorKind> getDetectors() {
        return detectors;
    }

    public String getExplanation() {
        return explanation;
    }

    public boolean isResolved() {
        return resolved;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public String getResolutionNote() {
        return resolutionNote;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return resolved == that.resolved
                && Objects.equals(id, that.id)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, resolved);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", tags=" + tags +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", expectedValue=" + expectedValue +
                ", deviationScore=" + deviationScore +
                ", severity=" + severity +
                ", type=" + anomalyType +
                ", confidence=" + confidence +
                ", method=" + method +
                ", resolved=" + resolved +
                '}';
    }
}
