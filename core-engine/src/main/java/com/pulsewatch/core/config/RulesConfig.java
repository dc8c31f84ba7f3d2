package com.pulsewatch.core.config;

import com.pulsewatch.core.model.AggregationRule;
import com.pulsewatch.core.model.Alert;
import com.pulsewatch.core.model.DetectionRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * engine:
 *   maxPointsPerMetric: 10000
 *   severityBands: { medium: 2.0, high: 3.0, critical: 4.0 }
 * detectionRules:
 *   - metricName: cpu
 *     organizationId: org1
 *     method: ENSEMBLE
 *     windowHours: 24
 * aggregationRules:
 *   - sourceMetric: requests
 *     targetMetric: requests_hourly
 *     level: HOUR
 *     function: COUNT
 *     organizationId: org1
 * alerts:
 *   - metricName: cpu
 *     organizationId: org1
 *     thresholdType: ABOVE
 *     thresholdValue: 90
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private EngineSettings engine = new EngineSettings();
    private List<DetectionRule> detectionRules = new ArrayList<>();
    private List<AggregationRule> aggregationRules = new ArrayList<>();
    private List<Alert> alerts = new ArrayList<>();

    public EngineSettings getEngine() {
        return engine;
    }

    public void setEngine(EngineSettings engine) {
        this.engine = engine != null ? engine : new EngineSettings();
    }

    /**
     * @return unmodifiable list of detection rules
     */
    public List<DetectionRule> getDetectionRules() {
        return Collections.unmodifiableList(detectionRules);
    }

    public void setDetectionRules(List<DetectionRule> detectionRules) {
        this.detectionRules = detectionRules != null ? new ArrayList<>(detectionRules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of aggregation rules
     */
    public List<AggregationRule> getAggregationRules() {
        return Collections.unmodifiableList(aggregationRules);
    }

    public void setAggregationRules(List<AggregationRule> aggregationRules) {
        this.aggregationRules = aggregationRules != null ? new ArrayList<>(aggregationRules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of alert rules
     */
    public List<Alert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    public void setAlerts(List<Alert> alerts) {
        this.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
    }

    public int totalRules() {
        return detectionRules.size() + aggregationRules.size() + alerts.size();
    }

    /**
     * Validate the engine section and every rule.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            engine.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        collect(errors, "detectionRules", detectionRules, DetectionRule::validate);
        collect(errors, "aggregationRules", aggregationRules, AggregationRule::validate);
        collect(errors, "alerts", alerts, Alert::validate);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static <T> void collect(List<String> errors, String section, List<T> entries,
            Consumer<T> validator) {
        for (int i = 0; i < entries.size(); i++) {
            T entry = entries.get(i);
            if (entry == null) {
                errors.add(section + "[" + i + "] is null");
                continue;
            }
            try {
                validator.accept(entry);
            } catch (IllegalArgumentException e) {
                errors.add(section + "[" + i + "]: " + e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{" +
                "engine=" + engine +
                ", detectionRules=" + detectionRules +
                ", aggregationRules=" + aggregationRules +
                ", alerts=" + alerts +
                '}';
    }
}
