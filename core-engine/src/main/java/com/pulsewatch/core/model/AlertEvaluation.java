package com.pulsewatch.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit record of one alert rule evaluation, kept whether or not it fired.
 *
 * @since 1.0.0
 */
public final class AlertEvaluation {

    private final String alertId;
    private final Instant evaluatedAt;
    /** {@code NaN} when the window held no data for the statistic. */
    private final double observedValue;
    private final boolean breached;
    private final boolean fired;

    public AlertEvaluation(String alertId, Instant evaluatedAt, double observedValue,
            boolean breached, boolean fired) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.evaluatedAt = Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
        this.observedValue = observedValue;
        this.breached = breached;
        this.fired = fired;
    }

    public String getAlertId() {
        return alertId;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public boolean isBreached() {
        return breached;
    }

    public boolean isFired() {
        return fired;
    }

    @Override
    public String toString() {
        return "AlertEvaluation{" +
                "alertId='" + alertId + '\'' +
                ", evaluatedAt=" + evaluatedAt +
                ", observedValue=" + observedValue +
                ", breached=" + breached +
                ", fired=" + fired +
                '}';
    }
}
