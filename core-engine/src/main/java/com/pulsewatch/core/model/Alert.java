package com.pulsewatch.core.model;

import com.pulsewatch.core.error.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A standing threshold rule over a live-window statistic of one metric.
 *
 * <p>
 * Alerts are created by configuration (YAML or
 * {@code AlertManager.configureAlert}) and evaluated continuously until
 * removed. {@code triggeredAt} records the most recent firing and is the only
 * field the engine writes.
 * </p>
 *
 * <h3>Example YAML</h3>
 *
 * <pre>
 * alerts:
 *   - metricName: cpu
 *     organizationId: org1
 *     thresholdType: ABOVE
 *     thresholdValue: 90
 *     severity: HIGH
 *     windowMinutes: 5
 * </pre>
 *
 * @since 1.0.0
 */
public class Alert {

    /** Assigned by the alert manager when left blank. */
    private String id;

    private String metricName;
    private String organizationId;
    private ThresholdType thresholdType = ThresholdType.ABOVE;
    private double thresholdValue;
    private Severity severity = Severity.MEDIUM;
    private int windowMinutes = 5;
    private AlertStatistic statistic = AlertStatistic.AVG;
    private volatile Instant triggeredAt;
    private boolean enabled = true;

    /** No-arg constructor required by SnakeYAML. */
    public Alert() {
    }

    /**
     * Convenience constructor for programmatic registration.
     */
    public Alert(String metricName, String organizationId, ThresholdType thresholdType,
            double thresholdValue, Severity severity, int windowMinutes) {
        this.metricName = metricName;
        this.organizationId = organizationId;
        this.thresholdType = thresholdType;
        this.thresholdValue = thresholdValue;
        this.severity = severity;
        this.windowMinutes = windowMinutes;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws ValidationException if the rule is incomplete or out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (metricName == null || metricName.isBlank()) {
            errors.add("Alert 'metricName' is required");
        }
        if (organizationId == null || organizationId.isBlank()) {
            errors.add("Alert 'organizationId' is required");
        }
        if (thresholdType == null) {
            errors.add("Alert 'thresholdType' is required");
        }
        if (!Double.isFinite(thresholdValue)) {
            errors.add("Alert 'thresholdValue' must be finite");
        }
        if (severity == null) {
            errors.add("Alert 'severity' is required");
        }
        if (windowMinutes < 1) {
            errors.add("Alert 'windowMinutes' must be >= 1");
        }
        if (statistic == null) {
            errors.add("Alert 'statistic' is required");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid Alert: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public ThresholdType getThresholdType() {
        return thresholdType;
    }

    public void setThresholdType(ThresholdType thresholdType) {
        this.thresholdType = thresholdType;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public void setThresholdValue(double thresholdValue) {
        this.thresholdValue = thresholdValue;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public AlertStatistic getStatistic() {
        return statistic;
    }

    public void setStatistic(AlertStatistic statistic) {
        this.statistic = statistic;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public void setTriggeredAt(Instant triggeredAt) {
        this.triggeredAt = triggeredAt;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(organizationId, that.organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, metricName, organizationId);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", metricName='" + metricName + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", " + statistic + ' ' + thresholdType + ' ' + thresholdValue +
                ", severity=" + severity +
                ", windowMinutes=" + windowMinutes +
                ", enabled=" + enabled +
                '}';
    }
}
