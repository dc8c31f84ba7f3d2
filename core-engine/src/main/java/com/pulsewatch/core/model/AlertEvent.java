package com.pulsewatch.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A firing emitted by the alert manager.
 *
 * <p>
 * Delivery is external: listeners receive these events and forward them to a
 * transport (the service publishes them to Kafka as JSON).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertId}, {@code organizationId},
 * {@code metricName}, {@code severity} and {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertEvent {

    /** Alert rule id, or the anomaly id for {@link AlertEventSource#ANOMALY}. */
    private final String alertId;
    private final AlertEventSource source;
    private final String organizationId;
    private final String metricName;
    private final double observedValue;
    private final double threshold;
    private final Severity severity;
    private final Instant timestamp;
    private final String message;

    private AlertEvent(Builder builder) {
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.source = builder.source;
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.observedValue = builder.observedValue;
        this.threshold = builder.threshold;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.message = builder.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String alertId;
        private AlertEventSource source = AlertEventSource.THRESHOLD;
        private String organizationId;
        private String metricName;
        private double observedValue;
        private double threshold;
        private Severity severity;
        private Instant timestamp;
        private String message;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder source(AlertEventSource source) {
            this.source = source;
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

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public AlertEvent build() {
            return new AlertEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAlertId() {
        return alertId;
    }

    public AlertEventSource getSource() {
        return source;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertEvent that))
            return false;
        return Double.compare(observedValue, that.observedValue) == 0
                && Objects.equals(alertId, that.alertId)
                && source == that.source
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, source, observedValue, timestamp);
    }

    @Override
    public String toString() {
        return "AlertEvent{" +
                "alertId='" + alertId + '\'' +
                ", source=" + source +
                ", organizationId='" + organizationId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", observedValue=" + observedValue +
                ", threshold=" + threshold +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
