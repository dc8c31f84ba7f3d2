package com.pulsewatch.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Wire form of one metric observation on the metrics topic.
 *
 * <pre>
 * {"metric_name":"cpu_usage","value":71.5,"organization_id":"acme",
 *  "timestamp":"2024-05-01T12:00:00Z","tags":{"host":"web-1"}}
 * </pre>
 *
 * <p>{@code timestamp} and {@code tags} are optional.</p>
 *
 * @since 1.0.0
 */
public class MetricMessage {

    @JsonProperty("metric_name")
    private String metricName;

    @JsonProperty("value")
    private Double value;

    @JsonProperty("organization_id")
    private String organizationId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("tags")
    private Map<String, String> tags;

    public MetricMessage() {
    }

    public MetricMessage(String metricName, Double value, String organizationId, Instant timestamp,
            Map<String, String> tags) {
        this.metricName = metricName;
        this.value = value;
        this.organizationId = organizationId;
        this.timestamp = timestamp;
        this.tags = tags;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags;
    }

    @Override
    public String toString() {
        return "MetricMessage{metricName='" + metricName + '\'' +
                ", value=" + value +
                ", organizationId='" + organizationId + '\'' +
                ", timestamp=" + timestamp +
                ", tags=" + tags + '}';
    }
}
