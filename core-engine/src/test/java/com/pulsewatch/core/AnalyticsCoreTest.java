package com.pulsewatch.core;

import com.pulsewatch.core.config.EngineSettings;
import com.pulsewatch.core.config.RulesConfig;
import com.pulsewatch.core.config.RulesLoader;
import com.pulsewatch.core.model.AlertEvent;
import com.pulsewatch.core.model.AlertEventSource;
import com.pulsewatch.core.model.Anomaly;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.storage.InMemoryTimeSeriesStore;
import com.pulsewatch.core.storage.MetricQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Integration tests for {@link AnalyticsCore} wiring the components together.
 */
class AnalyticsCoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String ORG = "org-a";

    private MutableClock clock;
    private InMemoryTimeSeriesStore store;
    private AnalyticsCore core;
    private final List<AlertEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        RulesConfig rules = RulesLoader.fromClasspath("test-rules.yml");
        clock = new MutableClock(NOW);
        store = new InMemoryTimeSeriesStore(clock);
        core = new AnalyticsCore(rules.getEngine(), store, clock);
        core.applyRules(rules);
        core.addAlertListener(events::add);
    }

    @AfterEach
    void tearDown() {
        core.close();
    }

    @Test
    @DisplayName("Should register every rule from the configuration")
    void shouldApplyRules() {
        assertThat(core.getAggregationPipeline().rules()).hasSize(1);
        assertThat(core.getDetectionEngine().rules(ORG))
                .extracting(r -> r.getId())
                .containsExactly("cpu-zscore");
        assertThat(core.getAlertManager().alert("cpu-high")).isPresent();
        assertThat(core.getWindowEngine().getMaxPointsPerMetric()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should carry a spike from ingestion through detection to an alert event")
    void shouldRunEndToEnd() {
        core.start();
        ingestSpike();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> store.size() == 51);

        List<Anomaly> anomalies = core.detect("cpu_usage", ORG, 1, null);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getValue()).isEqualTo(500.0);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(events)
                .filteredOn(e -> e.getSource() == AlertEventSource.ANOMALY)
                .extracting(AlertEvent::getAlertId)
                .containsExactly(anomaly.getId());
        assertThat(core.query(MetricQuery.builder("cpu_usage", ORG).build())).hasSize(51);
    }

    @Test
    @DisplayName("Should fire the threshold alert from the scheduled tick")
    void shouldFireThresholdAlertOnTick() {
        core.start();
        ingestSpike();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().anyMatch(e -> e.getSource() == AlertEventSource.THRESHOLD));

        AlertEvent event = events.stream()
                .filter(e -> e.getSource() == AlertEventSource.THRESHOLD)
                .findFirst()
                .orElseThrow();
        assertThat(event.getAlertId()).isEqualTo("cpu-high");
        assertThat(event.getObservedValue()).isGreaterThan(90.0);
    }

    @Test
    @DisplayName("Should keep ticking alerts while a detection sweep is stuck on the store")
    void shouldTickAlertsDuringSlowSweep() throws InterruptedException {
        RulesConfig rules = RulesLoader.fromClasspath("test-rules.yml");
        rules.getEngine().setDetectionIntervalSeconds(1);
        rules.getEngine().setAggregationTickSeconds(1);
        InMemoryTimeSeriesStore slowStore = spy(new InMemoryTimeSeriesStore(clock));
        CountDownLatch sweepEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            sweepEntered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return inv.callRealMethod();
        }).when(slowStore).query(argThat(q -> q != null && q.getMetricName().equals("cpu_usage")));

        AnalyticsCore slowCore = new AnalyticsCore(rules.getEngine(), slowStore, clock);
        List<AlertEvent> slowEvents = new CopyOnWriteArrayList<>();
        try {
            slowCore.applyRules(rules);
            slowCore.addAlertListener(slowEvents::add);
            for (int i = 0; i < 5; i++) {
                slowCore.ingest("cpu_usage", 99.0, ORG, NOW.minus(Duration.ofMinutes(i)), null);
            }
            slowCore.start();
            assertThat(sweepEntered.await(5, TimeUnit.SECONDS)).isTrue();

            await().atMost(Duration.ofSeconds(5))
                    .until(() -> slowEvents.stream().anyMatch(e -> e.getSource() == AlertEventSource.THRESHOLD));
            assertThat(release.getCount()).isEqualTo(1);
        } finally {
            release.countDown();
            slowCore.close();
        }
    }

    @Test
    @DisplayName("Should report health counters")
    void shouldReportHealth() {
        ingestSpike();
        core.ingest("latency_ms", 12.5, ORG, null, null);

        HealthSnapshot health = core.health();

        assertThat(health.getTrackedMetrics()).isEqualTo(2);
        assertThat(health.getBufferedPoints()).isEqualTo(52);
        assertThat(health.getIngestedTotal()).isEqualTo(52);
        assertThat(health.getActiveAlerts()).isEqualTo(1);
        assertThat(health.isDurabilityDegraded()).isFalse();
        assertThat(health.getRecordedAnomalies()).isZero();
    }

    @Test
    @DisplayName("Should purge stored points past the retention period")
    void shouldPurgeExpiredPoints() {
        store.write(point(NOW.minus(Duration.ofDays(100)), 1.0));
        store.write(point(NOW.minus(Duration.ofDays(1)), 2.0));

        assertThat(core.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject invalid engine settings")
    void shouldRejectInvalidSettings() {
        EngineSettings settings = new EngineSettings();
        settings.setAggregationWorkers(0);

        assertThatThrownBy(() -> new AnalyticsCore(settings, store, clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("aggregationWorkers");
    }

    @Test
    @DisplayName("Should refuse to start after close")
    void shouldRefuseRestart() {
        core.start();
        core.close();

        assertThatThrownBy(() -> core.start()).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ingestSpike() {
        for (int i = 0; i < 51; i++) {
            double value = i == 50 ? 500 : (i % 2 == 0 ? 105 : 95);
            core.ingest("cpu_usage", value, ORG, NOW.minus(Duration.ofMinutes(50 - i)), null);
        }
    }

    private static MetricPoint point(Instant timestamp, double value) {
        return MetricPoint.builder()
                .metricName("cpu_usage")
                .organizationId(ORG)
                .timestamp(timestamp)
                .value(value)
                .build();
    }
}
