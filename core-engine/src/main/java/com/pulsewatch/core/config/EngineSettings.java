package com.pulsewatch.core.config;

import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.util.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for every engine component, loaded from the {@code engine} section
 * of the rules YAML.
 *
 * <p>
 * Every field has a working default, so an absent section yields a usable
 * configuration. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineSettings {

    // live window
    private int maxPointsPerMetric = 10_000;
    private int liveRetentionHours = 24;

    // durability forwarding
    private int durabilityBatchSize = 500;
    private int durabilityQueueCapacity = 100_000;
    private int storageRetryAttempts = 5;
    private long storageRetryInitialDelayMs = 100;
    private long storageRetryMaxDelayMs = 5_000;

    // aggregation
    private int aggregationWorkers = 4;
    private int aggregationMaxInFlight = 16;
    private int aggregationMaxAttempts = 5;
    private long aggregationRetryInitialDelayMs = 1_000;
    private int aggregationTickSeconds = 10;
    private int aggregationLookbackBuckets = 2;

    // detection
    private int detectionIntervalSeconds = 60;
    private int detectionWindowHours = 1;
    private SeverityBands severityBands = new SeverityBands();
    private Severity anomalyAlertMinSeverity = Severity.HIGH;

    // alerts
    private int alertMaxTickSeconds = 10;
    private int alertAuditCapacity = 10_000;

    // store
    private int storeRetentionDays = 90;

    /**
     * Validate every setting, collecting all problems into one exception.
     *
     * @throws IllegalStateException if any setting is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requirePositive(errors, "maxPointsPerMetric", maxPointsPerMetric);
        requirePositive(errors, "liveRetentionHours", liveRetentionHours);
        requirePositive(errors, "durabilityBatchSize", durabilityBatchSize);
        requirePositive(errors, "durabilityQueueCapacity", durabilityQueueCapacity);
        requirePositive(errors, "storageRetryAttempts", storageRetryAttempts);
        if (storageRetryInitialDelayMs < 0 || storageRetryMaxDelayMs < storageRetryInitialDelayMs) {
            errors.add("'storageRetryInitialDelayMs' must be >= 0 and <= 'storageRetryMaxDelayMs'");
        }
        requirePositive(errors, "aggregationWorkers", aggregationWorkers);
        requirePositive(errors, "aggregationMaxInFlight", aggregationMaxInFlight);
        requirePositive(errors, "aggregationMaxAttempts", aggregationMaxAttempts);
        if (aggregationRetryInitialDelayMs < 0) {
            errors.add("'aggregationRetryInitialDelayMs' must be >= 0");
        }
        requirePositive(errors, "aggregationTickSeconds", aggregationTickSeconds);
        requirePositive(errors, "aggregationLookbackBuckets", aggregationLookbackBuckets);
        requirePositive(errors, "detectionIntervalSeconds", detectionIntervalSeconds);
        requirePositive(errors, "detectionWindowHours", detectionWindowHours);
        requirePositive(errors, "alertMaxTickSeconds", alertMaxTickSeconds);
        requirePositive(errors, "alertAuditCapacity", alertAuditCapacity);
        requirePositive(errors, "storeRetentionDays", storeRetentionDays);
        if (severityBands == null) {
            errors.add("'severityBands' is required");
        } else {
            severityBands.collectErrors(errors);
        }
        if (anomalyAlertMinSeverity == null) {
            errors.add("'anomalyAlertMinSeverity' is required");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid engine settings: " + String.join("; ", errors));
        }
    }

    private static void requirePositive(List<String> errors, String name, long value) {
        if (value < 1) {
            errors.add("'" + name + "' must be >= 1, got " + value);
        }
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    public RetryPolicy storageRetryPolicy() {
        return new RetryPolicy(storageRetryAttempts,
                Duration.ofMillis(storageRetryInitialDelayMs),
                Duration.ofMillis(storageRetryMaxDelayMs), 2.0);
    }

    /**
     * Backoff between aggregation job attempts; capped at one minute.
     */
    public RetryPolicy aggregationRetryPolicy() {
        return new RetryPolicy(aggregationMaxAttempts,
                Duration.ofMillis(aggregationRetryInitialDelayMs),
                Duration.ofMillis(Math.max(aggregationRetryInitialDelayMs, 60_000)), 2.0);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMaxPointsPerMetric() {
        return maxPointsPerMetric;
    }

    public void setMaxPointsPerMetric(int maxPointsPerMetric) {
        this.maxPointsPerMetric = maxPointsPerMetric;
    }

    public int getLiveRetentionHours() {
        return liveRetentionHours;
    }

    public void setLiveRetentionHours(int liveRetentionHours) {
        this.liveRetentionHours = liveRetentionHours;
    }

    public int getDurabilityBatchSize() {
        return durabilityBatchSize;
    }

    public void setDurabilityBatchSize(int durabilityBatchSize) {
        this.durabilityBatchSize = durabilityBatchSize;
    }

    public int getDurabilityQueueCapacity() {
        return durabilityQueueCapacity;
    }

    public void setDurabilityQueueCapacity(int durabilityQueueCapacity) {
        this.durabilityQueueCapacity = durabilityQueueCapacity;
    }

    public int getStorageRetryAttempts() {
        return storageRetryAttempts;
    }

    public void setStorageRetryAttempts(int storageRetryAttempts) {
        this.storageRetryAttempts = storageRetryAttempts;
    }

    public long getStorageRetryInitialDelayMs() {
        return storageRetryInitialDelayMs;
    }

    public void setStorageRetryInitialDelayMs(long storageRetryInitialDelayMs) {
        this.storageRetryInitialDelayMs = storageRetryInitialDelayMs;
    }

    public long getStorageRetryMaxDelayMs() {
        return storageRetryMaxDelayMs;
    }

    public void setStorageRetryMaxDelayMs(long storageRetryMaxDelayMs) {
        this.storageRetryMaxDelayMs = storageRetryMaxDelayMs;
    }

    public int getAggregationWorkers() {
        return aggregationWorkers;
    }

    public void setAggregationWorkers(int aggregationWorkers) {
        this.aggregationWorkers = aggregationWorkers;
    }

    public int getAggregationMaxInFlight() {
        return aggregationMaxInFlight;
    }

    public void setAggregationMaxInFlight(int aggregationMaxInFlight) {
        this.aggregationMaxInFlight = aggregationMaxInFlight;
    }

    public int getAggregationMaxAttempts() {
        return aggregationMaxAttempts;
    }

    public void setAggregationMaxAttempts(int aggregationMaxAttempts) {
        this.aggregationMaxAttempts = aggregationMaxAttempts;
    }

    public long getAggregationRetryInitialDelayMs() {
        return aggregationRetryInitialDelayMs;
    }

    public void setAggregationRetryInitialDelayMs(long aggregationRetryInitialDelayMs) {
        this.aggregationRetryInitialDelayMs = aggregationRetryInitialDelayMs;
    }

    public int getAggregationTickSeconds() {
        return aggregationTickSeconds;
    }

    public void setAggregationTickSeconds(int aggregationTickSeconds) {
        this.aggregationTickSeconds = aggregationTickSeconds;
    }

    public int getAggregationLookbackBuckets() {
        return aggregationLookbackBuckets;
    }

    public void setAggregationLookbackBuckets(int aggregationLookbackBuckets) {
        this.aggregationLookbackBuckets = aggregationLookbackBuckets;
    }

    public int getDetectionIntervalSeconds() {
        return detectionIntervalSeconds;
    }

    public void setDetectionIntervalSeconds(int detectionIntervalSeconds) {
        this.detectionIntervalSeconds = detectionIntervalSeconds;
    }

    public int getDetectionWindowHours() {
        return detectionWindowHours;
    }

    public void setDetectionWindowHours(int detectionWindowHours) {
        this.detectionWindowHours = detectionWindowHours;
    }

    public SeverityBands getSeverityBands() {
        return severityBands;
    }

    public void setSeverityBands(SeverityBands severityBands) {
        this.severityBands = severityBands;
    }

    public Severity getAnomalyAlertMinSeverity() {
        return anomalyAlertMinSeverity;
    }

    public void setAnomalyAlertMinSeverity(Severity anomalyAlertMinSeverity) {
        this.anomalyAlertMinSeverity = anomalyAlertMinSeverity;
    }

    public int getAlertMaxTickSeconds() {
        return alertMaxTickSeconds;
    }

    public void setAlertMaxTickSeconds(int alertMaxTickSeconds) {
        this.alertMaxTickSeconds = alertMaxTickSeconds;
    }

    public int getAlertAuditCapacity() {
        return alertAuditCapacity;
    }

    public void setAlertAuditCapacity(int alertAuditCapacity) {
        this.alertAuditCapacity = alertAuditCapacity;
    }

    public int getStoreRetentionDays() {
        return storeRetentionDays;
    }

    public void setStoreRetentionDays(int storeRetentionDays) {
        this.storeRetentionDays = storeRetentionDays;
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "maxPointsPerMetric=" + maxPointsPerMetric +
                ", liveRetentionHours=" + liveRetentionHours +
                ", durabilityBatchSize=" + durabilityBatchSize +
                ", aggregationWorkers=" + aggregationWorkers +
                ", aggregationMaxInFlight=" + aggregationMaxInFlight +
                ", detectionIntervalSeconds=" + detectionIntervalSeconds +
                ", severityBands=" + severityBands +
                ", storeRetentionDays=" + storeRetentionDays +
                '}';
    }
}
