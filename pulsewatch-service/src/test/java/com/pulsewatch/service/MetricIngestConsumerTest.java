package com.pulsewatch.service;

import com.pulsewatch.core.AnalyticsCore;
import com.pulsewatch.core.config.EngineSettings;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.storage.InMemoryTimeSeriesStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricIngestConsumer}.
 */
class MetricIngestConsumerTest {

    private static final String TOPIC = "metrics";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
    private static final int TEN_YEARS_MINUTES = 10 * 365 * 24 * 60;

    private MockConsumer<String, byte[]> kafka;
    private AnalyticsCore core;
    private ServiceMetrics metrics;
    private MetricIngestConsumer consumer;

    @BeforeEach
    void setUp() {
        kafka = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        core = new AnalyticsCore(new EngineSettings(), new InMemoryTimeSeriesStore(), Clock.systemUTC());
        metrics = new ServiceMetrics(new SimpleMeterRegistry());
        consumer = new MetricIngestConsumer(kafka, TOPIC, core, new MetricMessageParser(), metrics);
    }

    @AfterEach
    void tearDown() {
        core.close();
    }

    @Test
    @DisplayName("Should ingest valid records and skip bad ones until shut down")
    void shouldConsumeUntilShutdown() {
        kafka.schedulePollTask(() -> {
            kafka.rebalance(List.of(PARTITION));
            kafka.addRecord(record(0, "{\"metric_name\":\"cpu_usage\",\"value\":42.0,"
                    + "\"organization_id\":\"org-a\",\"timestamp\":\"2024-05-01T12:00:00Z\"}"));
            kafka.addRecord(record(1, "garbage"));
            kafka.addRecord(record(2, "{\"metric_name\":\"cpu_usage\",\"value\":43.0,"
                    + "\"organization_id\":\"org-a\"}"));
        });
        kafka.schedulePollTask(consumer::shutdown);
        kafka.updateBeginningOffsets(Map.of(PARTITION, 0L));

        consumer.run();

        assertThat(metrics.messagesIngested()).isEqualTo(2.0);
        assertThat(metrics.messagesRejected()).isEqualTo(1.0);
        assertThat(core.getWindowEngine().bufferSize("cpu_usage", "org-a")).isEqualTo(2);
        assertThat(consumer.isRunning()).isFalse();
        assertThat(kafka.closed()).isTrue();
    }

    @Test
    @DisplayName("Should keep the message timestamp and tags")
    void shouldKeepTimestampAndTags() {
        boolean ingested = consumer.handle(record(0, "{\"metric_name\":\"latency_ms\",\"value\":12.5,"
                + "\"organization_id\":\"org-a\",\"timestamp\":\"2024-05-01T12:00:00Z\","
                + "\"tags\":{\"region\":\"eu\"}}"));

        assertThat(ingested).isTrue();
        MetricPoint point = core.getWindowEngine().windowPoints("latency_ms", "org-a", TEN_YEARS_MINUTES)
                .get(0);
        assertThat(point.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(point.getTags()).containsEntry("region", "eu");
    }

    @Test
    @DisplayName("Should reject a non-finite value as a bad record")
    void shouldRejectNonFiniteValue() {
        boolean ingested = consumer.handle(record(0,
                "{\"metric_name\":\"cpu\",\"value\":\"NaN\",\"organization_id\":\"org-a\"}"));

        assertThat(ingested).isFalse();
        assertThat(metrics.messagesRejected()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ConsumerRecord<String, byte[]> record(long offset, String json) {
        return new ConsumerRecord<>(TOPIC, 0, offset, "org-a", json.getBytes(StandardCharsets.UTF_8));
    }
}
