package com.pulsewatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsewatch.core.model.AlertEvent;
import com.pulsewatch.core.model.AlertEventSource;
import com.pulsewatch.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertEventSerializer}.
 */
class AlertEventSerializerTest {

    @Test
    @DisplayName("Should write snake_case fields and an ISO-8601 timestamp")
    void shouldSerializeSnakeCase() throws Exception {
        AlertEvent event = AlertEvent.builder()
                .alertId("cpu-high")
                .source(AlertEventSource.THRESHOLD)
                .organizationId("org-a")
                .metricName("cpu_usage")
                .observedValue(95.0)
                .threshold(90.0)
                .severity(Severity.HIGH)
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
                .message("avg(cpu_usage) over 5m = 95.00, above threshold 90.00")
                .build();

        JsonNode json = new ObjectMapper().readTree(new AlertEventSerializer().serialize(event));

        assertThat(json.get("alert_id").asText()).isEqualTo("cpu-high");
        assertThat(json.get("source").asText()).isEqualTo("THRESHOLD");
        assertThat(json.get("organization_id").asText()).isEqualTo("org-a");
        assertThat(json.get("metric_name").asText()).isEqualTo("cpu_usage");
        assertThat(json.get("observed_value").asDouble()).isEqualTo(95.0);
        assertThat(json.get("threshold").asDouble()).isEqualTo(90.0);
        assertThat(json.get("severity").asText()).isEqualTo("HIGH");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.has("alertId")).isFalse();
    }
}
