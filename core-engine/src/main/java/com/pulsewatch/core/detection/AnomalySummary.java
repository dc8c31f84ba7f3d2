package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.AnomalyType;
import com.pulsewatch.core.model.Severity;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Roll-up of one organization's recent anomalies.
 *
 * @since 1.0.0
 */
public final class AnomalySummary {

    private final String organizationId;
    private final int hoursBack;
    private final long total;
    private final Map<Severity, Long> bySeverity;
    private final Map<String, Long> byMetric;
    private final Map<AnomalyType, Long> byType;
    private final long unresolved;
    private final double detectionRatePerHour;
    private final List<Map.Entry<String, Long>> topMetrics;

    AnomalySummary(String organizationId, int hoursBack, long total, Map<Severity, Long> bySeverity,
            Map<String, Long> byMetric, Map<AnomalyType, Long> byType, long unresolved,
            double detectionRatePerHour, List<Map.Entry<String, Long>> topMetrics) {
        this.organizationId = organizationId;
        this.hoursBack = hoursBack;
        this.total = total;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byMetric = Collections.unmodifiableMap(byMetric);
        this.byType = Collections.unmodifiableMap(byType);
        this.unresolved = unresolved;
        this.detectionRatePerHour = detectionRatePerHour;
        this.topMetrics = List.copyOf(topMetrics);
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public int getHoursBack() {
        return hoursBack;
    }

    public long getTotal() {
        return total;
    }

    public Map<Severity, Long> getBySeverity() {
        return bySeverity;
    }

    public Map<String, Long> getByMetric() {
        return byMetric;
    }

    public Map<AnomalyType, Long> getByType() {
        return byType;
    }

    public long getUnresolved() {
        return unresolved;
    }

    /** Anomalies per hour over the summarised period. */
    public double getDetectionRatePerHour() {
        return detectionRatePerHour;
    }

    /** Up to five metrics with the most anomalies, most anomalous first. */
    public List<Map.Entry<String, Long>> getTopMetrics() {
        return topMetrics;
    }

    @Override
    public String toString() {
        return "AnomalySummary{" +
                "organizationId='" + organizationId + '\'' +
                ", hoursBack=" + hoursBack +
                ", total=" + total +
                ", bySeverity=" + bySeverity +
                ", unresolved=" + unresolved +
                ", topMetrics=" + topMetrics +
                '}';
    }
}
