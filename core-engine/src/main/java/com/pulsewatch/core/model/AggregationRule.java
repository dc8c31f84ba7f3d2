package com.pulsewatch.core.model;

import com.pulsewatch.core.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes one rollup: which source metric of which organization is
 * summarised into which target metric, at what granularity and with which
 * function.
 *
 * <p>
 * Mutable so it can be populated from YAML; call {@link #validate()} before
 * registering it with the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationRule {

    private String sourceMetric;
    private String targetMetric;
    private AggregationLevel level;
    private AggregationFunction function;
    private String organizationId;
    private List<String> groupByTags = new ArrayList<>();

    /** Percentile in [0, 100]; only used with {@link AggregationFunction#PERCENTILE}. */
    private double percentile = 50.0;

    private boolean enabled = true;

    /**
     * Identifier of the form {@code org:source:target:LEVEL}. Derived from the
     * current settings, so it changes when they do.
     */
    public String getId() {
        return organizationId + ":" + sourceMetric + ":" + targetMetric + ":" + level;
    }

    /**
     * @return an independent copy carrying the same settings
     */
    public AggregationRule copy() {
        AggregationRule copy = new AggregationRule();
        copy.sourceMetric = sourceMetric;
        copy.targetMetric = targetMetric;
        copy.level = level;
        copy.function = function;
        copy.organizationId = organizationId;
        copy.groupByTags = new ArrayList<>(groupByTags);
        copy.percentile = percentile;
        copy.enabled = enabled;
        return copy;
    }

    /**
     * Validate the rule.
     *
     * @throws ValidationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (sourceMetric == null || sourceMetric.isBlank()) {
            errors.add("'sourceMetric' is required");
        }
        if (targetMetric == null || targetMetric.isBlank()) {
            errors.add("'targetMetric' is required");
        }
        if (sourceMetric != null && sourceMetric.equals(targetMetric)) {
            errors.add("'targetMetric' must differ from 'sourceMetric' (" + sourceMetric + ")");
        }
        if (organizationId == null || organizationId.isBlank()) {
            errors.add("'organizationId' is required");
        }
        if (level == null) {
            errors.add("'level' is required");
        }
        if (function == null) {
            errors.add("'function' is required");
        }
        if (percentile < 0 || percentile > 100) {
            errors.add("'percentile' must be in [0, 100], got: " + percentile);
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid AggregationRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getSourceMetric() {
        return sourceMetric;
    }

    public void setSourceMetric(String sourceMetric) {
        this.sourceMetric = sourceMetric;
    }

    public String getTargetMetric() {
        return targetMetric;
    }

    public void setTargetMetric(String targetMetric) {
        this.targetMetric = targetMetric;
    }

    public AggregationLevel getLevel() {
        return level;
    }

    public void setLevel(AggregationLevel level) {
        this.level = level;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public void setFunction(AggregationFunction function) {
        this.function = function;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    /**
     * @return unmodifiable list of tag keys to group by
     */
    public List<String> getGroupByTags() {
        return Collections.unmodifiableList(groupByTags);
    }

    public void setGroupByTags(List<String> groupByTags) {
        this.groupByTags = groupByTags != null ? new ArrayList<>(groupByTags) : new ArrayList<>();
    }

    public double getPercentile() {
        return percentile;
    }

    public void setPercentile(double percentile) {
        this.percentile = percentile;
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
        if (!(o instanceof AggregationRule that))
            return false;
        return Objects.equals(getId(), that.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getId());
    }

    @Override
    public String toString() {
        return "AggregationRule{" +
                "sourceMetric='" + sourceMetric + '\'' +
                ", targetMetric='" + targetMetric + '\'' +
                ", level=" + level +
                ", function=" + function +
                ", organizationId='" + organizationId + '\'' +
                ", groupByTags=" + groupByTags +
                ", enabled=" + enabled +
                '}';
    }
}
