package com.pulsewatch.service;

import com.pulsewatch.core.alert.AlertListener;
import com.pulsewatch.core.model.AlertEvent;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Publishes alert events to the alerts topic, keyed by organization id so a
 * tenant's events stay ordered within one partition.
 *
 * <p>
 * Sends are asynchronous. Serialization and delivery failures are logged
 * and counted; they never propagate into the alert evaluation.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertPublisher implements AlertListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertPublisher.class);

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final AlertEventSerializer serializer;
    private final ServiceMetrics metrics;

    public KafkaAlertPublisher(Producer<String, byte[]> producer, String topic,
            AlertEventSerializer serializer, ServiceMetrics metrics) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void onAlert(AlertEvent event) {
        byte[] payload;
        try {
            payload = serializer.serialize(event);
        } catch (IllegalArgumentException e) {
            metrics.alertFailed();
            LOG.error("Dropping alert event {}: {}", event.getAlertId(), e.getMessage(), e);
            return;
        }
        producer.send(new ProducerRecord<>(topic, event.getOrganizationId(), payload), (meta, ex) -> {
            if (ex != null) {
                metrics.alertFailed();
                LOG.warn("Failed to publish alert event {} for {}: {}",
                        event.getAlertId(), event.getOrganizationId(), ex.getMessage());
            } else {
                metrics.alertPublished();
                LOG.debug("Published alert event {} to {}-{}@{}",
                        event.getAlertId(), meta.topic(), meta.partition(), meta.offset());
            }
        });
    }

    @Override
    public void close() {
        producer.flush();
        producer.close(Duration.ofSeconds(10));
        LOG.info("Alert publisher closed");
    }
}
