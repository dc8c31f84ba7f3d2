package com.pulsewatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Converts raw metrics-topic bytes into {@link MetricMessage}s.
 *
 * <p>
 * Unknown properties are ignored. Missing required fields and JSON errors
 * raise {@link InvalidMessageException}; the caller decides whether to skip.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricMessageParser {

    private final ObjectMapper mapper;

    public MetricMessageParser() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws InvalidMessageException if the payload is empty, not JSON, or
     *                                 lacks {@code metric_name},
     *                                 {@code organization_id} or {@code value}
     */
    public MetricMessage parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new InvalidMessageException("Empty metric message");
        }
        MetricMessage message;
        try {
            message = mapper.readValue(payload, MetricMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed metric message: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidMessageException("Unreadable metric message: " + e.getMessage(), e);
        }
        if (message == null) {
            throw new InvalidMessageException("Metric message is JSON null");
        }
        if (message.getMetricName() == null || message.getMetricName().isBlank()) {
            throw new InvalidMessageException("metric_name is required");
        }
        if (message.getOrganizationId() == null || message.getOrganizationId().isBlank()) {
            throw new InvalidMessageException("organization_id is required");
        }
        if (message.getValue() == null) {
            throw new InvalidMessageException("value is required");
        }
        return message;
    }
}
