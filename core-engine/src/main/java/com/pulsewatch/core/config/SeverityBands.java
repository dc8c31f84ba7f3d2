package com.pulsewatch.core.config;

import com.pulsewatch.core.model.Severity;

import java.util.List;

/**
 * Maps a composite deviation score (sigma-equivalent units) to a
 * {@link Severity}.
 *
 * <p>
 * Bands are half-open and monotonic: {@code score < medium} is LOW,
 * {@code medium <= score < high} is MEDIUM, {@code high <= score < critical} is
 * HIGH and anything at or above {@code critical} is CRITICAL.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityBands {

    private double medium = 2.0;
    private double high = 3.0;
    private double critical = 4.0;

    /** No-arg constructor required by SnakeYAML. */
    public SeverityBands() {
    }

    public SeverityBands(double medium, double high, double critical) {
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    public Severity classify(double score) {
        if (score >= critical) {
            return Severity.CRITICAL;
        }
        if (score >= high) {
            return Severity.HIGH;
        }
        if (score >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    void collectErrors(List<String> errors) {
        if (!(medium > 0)) {
            errors.add("'severityBands.medium' must be > 0");
        }
        if (!(medium < high && high < critical)) {
            errors.add("'severityBands' must be strictly increasing (medium < high < critical), got "
                    + medium + " / " + high + " / " + critical);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getMedium() {
        return medium;
    }

    public void setMedium(double medium) {
        this.medium = medium;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    @Override
    public String toString() {
        return "SeverityBands{medium=" + medium + ", high=" + high + ", critical=" + critical + '}';
    }
}
