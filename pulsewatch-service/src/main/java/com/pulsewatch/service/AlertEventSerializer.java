package com.pulsewatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pulsewatch.core.model.AlertEvent;

/**
 * Converts {@link AlertEvent} to snake_case JSON bytes for the alerts topic.
 * Instants are written as ISO-8601 strings.
 *
 * @since 1.0.0
 */
public class AlertEventSerializer {

    private final ObjectMapper mapper;

    public AlertEventSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    /**
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public byte[] serialize(AlertEvent event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize alert event " + event.getAlertId(), e);
        }
    }
}
