package com.pulsewatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricMessageParser}.
 */
class MetricMessageParserTest {

    private final MetricMessageParser parser = new MetricMessageParser();

    @Test
    @DisplayName("Should parse a complete snake_case message")
    void shouldParseCompleteMessage() {
        MetricMessage message = parser.parse(bytes("{\"metric_name\":\"cpu_usage\",\"value\":42.5,"
                + "\"organization_id\":\"org-a\",\"timestamp\":\"2024-05-01T12:00:00Z\","
                + "\"tags\":{\"host\":\"web-1\"}}"));

        assertThat(message.getMetricName()).isEqualTo("cpu_usage");
        assertThat(message.getValue()).isEqualTo(42.5);
        assertThat(message.getOrganizationId()).isEqualTo("org-a");
        assertThat(message.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(message.getTags()).containsEntry("host", "web-1");
    }

    @Test
    @DisplayName("Should leave timestamp and tags empty when absent and ignore unknown fields")
    void shouldParseMinimalMessage() {
        MetricMessage message = parser.parse(bytes(
                "{\"metric_name\":\"requests\",\"value\":1,\"organization_id\":\"org-b\",\"unit\":\"count\"}"));

        assertThat(message.getTimestamp()).isNull();
        assertThat(message.getValue()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"value\":1,\"organization_id\":\"org-a\"}",
            "{\"metric_name\":\"cpu\",\"value\":1}",
            "{\"metric_name\":\"cpu\",\"organization_id\":\"org-a\"}",
            "{\"metric_name\":\" \",\"value\":1,\"organization_id\":\"org-a\"}",
            "null",
            "{not json"
    })
    @DisplayName("Should reject incomplete or malformed messages")
    void shouldRejectInvalidMessages(String payload) {
        assertThatThrownBy(() -> parser.parse(bytes(payload)))
                .isInstanceOf(InvalidMessageException.class);
    }

    @Test
    @DisplayName("Should describe a JSON syntax error without the parser's source location")
    void shouldDescribeSyntaxError() {
        assertThatThrownBy(() -> parser.parse(bytes("{\"metric_name\": cpu}")))
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageStartingWith("Malformed metric message: ")
                .hasMessageNotContaining("[Source:")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    @DisplayName("Should reject an empty payload")
    void shouldRejectEmptyPayload() {
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("Empty");
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(InvalidMessageException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
