package com.pulsewatch.service;

import com.pulsewatch.core.AnalyticsCore;
import com.pulsewatch.core.error.ValidationException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Poll loop that feeds metric messages from Kafka into the core.
 *
 * <p>
 * Each record is parsed and ingested independently. Malformed or invalid
 * records are counted, logged and skipped; the loop keeps going. Call
 * {@link #shutdown()} from another thread to stop it.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricIngestConsumer implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricIngestConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<String, byte[]> consumer;
    private final String topic;
    private final AnalyticsCore core;
    private final MetricMessageParser parser;
    private final ServiceMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public MetricIngestConsumer(Consumer<String, byte[]> consumer, String topic, AnalyticsCore core,
            MetricMessageParser parser, ServiceMetrics metrics) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.core = Objects.requireNonNull(core, "core must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void run() {
        try {
            consumer.subscribe(List.of(topic));
            LOG.info("Consuming metrics from topic '{}'", topic);
            while (running.get()) {
                ConsumerRecords<String, byte[]> records = consumer.poll(POLL_TIMEOUT);
                for (ConsumerRecord<String, byte[]> record : records) {
                    handle(record);
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            LOG.info("Metric consumer stopped");
        }
    }

    /**
     * @return {@code true} if the record was ingested
     */
    boolean handle(ConsumerRecord<String, byte[]> record) {
        long started = System.nanoTime();
        try {
            MetricMessage message = parser.parse(record.value());
            core.ingest(message.getMetricName(), message.getValue(), message.getOrganizationId(),
                    message.getTimestamp(), message.getTags());
            metrics.messageIngested(Duration.ofNanos(System.nanoTime() - started));
            return true;
        } catch (InvalidMessageException | ValidationException e) {
            metrics.messageRejected();
            LOG.warn("Skipping metric record {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return false;
        }
    }

    public void shutdown() {
        running.set(false);
        consumer.wakeup();
    }

    public boolean isRunning() {
        return running.get();
    }
}
