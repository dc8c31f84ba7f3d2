package com.pulsewatch.core.model;

import com.pulsewatch.core.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes a standing anomaly-detection rule for one metric of one
 * organization.
 *
 * <p>
 * Supported methods:
 * </p>
 * <ul>
 * <li>{@code STATISTICAL} — a single z-score, IQR or modified z-score test</li>
 * <li>{@code ISOLATION_FOREST} — isolation forest over engineered features</li>
 * <li>{@code LOF} — local outlier factor over engineered features</li>
 * <li>{@code ENSEMBLE} — several detectors combined by vote</li>
 * </ul>
 *
 * <p>
 * Disabled rules are stored but never evaluated. Call {@link #validate()} after
 * construction / deserialization to verify the rule.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule {

    /** Assigned by the engine when left blank. */
    private String id;

    private String metricName;
    private String organizationId;
    private DetectionMethod method = DetectionMethod.ENSEMBLE;
    private DetectorParameters parameters = new DetectorParameters();

    /** Length of history analysed per run. */
    private int windowHours = 24;

    private DetectionSource source = DetectionSource.HISTORY;

    /** Rollup level read when {@code source} is {@code AGGREGATED}. */
    private AggregationLevel aggregationLevel;

    private boolean enabled = true;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields are present and contain legal values.
     *
     * @throws ValidationException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String owner = "Detection rule '" + (id != null ? id : metricName) + "'";

        if (metricName == null || metricName.isBlank()) {
            errors.add("Rule 'metricName' is required");
        }
        if (organizationId == null || organizationId.isBlank()) {
            errors.add("Rule 'organizationId' is required");
        }
        if (method == null) {
            errors.add("Rule 'method' is required");
        }
        if (windowHours < 1) {
            errors.add(owner + " requires 'windowHours' >= 1");
        }
        if (source == null) {
            errors.add(owner + " requires 'source'");
        } else if (source == DetectionSource.AGGREGATED && aggregationLevel == null) {
            errors.add(owner + " reads aggregated history and requires 'aggregationLevel'");
        }
        if (parameters == null) {
            errors.add(owner + " requires 'parameters'");
        } else if (method == DetectionMethod.ENSEMBLE) {
            parameters.collectErrors(errors, owner);
        } else {
            // voting settings only matter for ensembles
            List<String> paramErrors = new ArrayList<>();
            parameters.collectErrors(paramErrors, owner);
            paramErrors.removeIf(e -> e.contains("'votingThreshold'") || e.contains("'detectors'"));
            errors.addAll(paramErrors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid DetectionRule: " + String.join("; ", errors));
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

    public DetectionMethod getMethod() {
        return method;
    }

    public void setMethod(DetectionMethod method) {
        this.method = method;
    }

    public DetectorParameters getParameters() {
        return parameters;
    }

    public void setParameters(DetectorParameters parameters) {
        this.parameters = parameters;
    }

    public int getWindowHours() {
        return windowHours;
    }

    public void setWindowHours(int windowHours) {
        this.windowHours = windowHours;
    }

    public DetectionSource getSource() {
        return source;
    }

    public void setSource(DetectionSource source) {
        this.source = source;
    }

    public AggregationLevel getAggregationLevel() {
        return aggregationLevel;
    }

    public void setAggregationLevel(AggregationLevel aggregationLevel) {
        this.aggregationLevel = aggregationLevel;
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
        if (!(o instanceof DetectionRule that))
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
        return "DetectionRule{" +
                "id='" + id + '\'' +
                ", metricName='" + metricName + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", method=" + method +
                ", windowHours=" + windowHours +
                ", source=" + source +
                ", enabled=" + enabled +
                ", parameters=" + parameters +
                '}';
    }
}
