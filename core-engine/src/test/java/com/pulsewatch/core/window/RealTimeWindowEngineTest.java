package com.pulsewatch.core.window;

import com.pulsewatch.core.MutableClock;
import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RealTimeWindowEngine}.
 */
class RealTimeWindowEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private RealTimeWindowEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        engine = new RealTimeWindowEngine(100, null, clock);
    }

    @Test
    @DisplayName("Should report a spike as the window max")
    void shouldReportSpikeInWindowStats() {
        for (int i = 0; i < 50; i++) {
            engine.ingest("cpu_usage", 100 + (i % 2 == 0 ? 5 : -5), "org-a", NOW.minusSeconds(50 - i), null);
        }
        engine.ingest("cpu_usage", 500, "org-a", NOW, null);

        WindowStats stats = engine.windowStats("cpu_usage", "org-a", 5);

        assertThat(stats.getCount()).isEqualTo(51);
        assertThat(stats.getMax()).isEqualTo(500.0);
        assertThat(stats.getLastValue()).isEqualTo(500.0);
        assertThat(stats.getRatePerMinute()).isEqualTo(51 / 5.0);
    }

    @Test
    @DisplayName("Should exclude points older than the requested window")
    void shouldRespectWindowBounds() {
        engine.ingest("cpu_usage", 10, "org-a", NOW.minus(Duration.ofMinutes(10)), null);
        engine.ingest("cpu_usage", 20, "org-a", NOW.minus(Duration.ofMinutes(2)), null);

        assertThat(engine.windowStats("cpu_usage", "org-a", 5).getCount()).isEqualTo(1);
        assertThat(engine.windowStats("cpu_usage", "org-a", 15).getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return empty stats for an unknown key")
    void shouldReturnEmptyStats() {
        WindowStats stats = engine.windowStats("missing", "org-a", 5);

        assertThat(stats.isEmpty()).isTrue();
        assertThat(stats.getCount()).isZero();
    }

    @Test
    @DisplayName("Should keep organizations apart in the live buffers")
    void shouldIsolateTenants() {
        engine.ingest("cpu_usage", 10, "org-a", null, null);
        engine.ingest("cpu_usage", 999, "org-b", null, null);

        assertThat(engine.windowStats("cpu_usage", "org-a", 5).getMax()).isEqualTo(10.0);
        assertThat(engine.windowStats("cpu_usage", "org-b", 5).getMax()).isEqualTo(999.0);
        assertThat(engine.trackedMetrics()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should bound each buffer to the configured capacity")
    void shouldBoundBuffer() {
        RealTimeWindowEngine small = new RealTimeWindowEngine(10, null, clock);
        for (int i = 0; i < 25; i++) {
            small.ingest("cpu_usage", i, "org-a", NOW, null);
        }

        assertThat(small.bufferSize("cpu_usage", "org-a")).isEqualTo(10);
        assertThat(small.windowPoints("cpu_usage", "org-a", 5))
                .extracting(MetricPoint::getValue)
                .startsWith(15.0)
                .endsWith(24.0);
        assertThat(small.ingestedTotal()).isEqualTo(25);
    }

    @Test
    @DisplayName("Should narrow stats by tag without creating extra buffers")
    void shouldFilterByTags() {
        engine.ingest("latency", 10, "org-a", NOW, Map.of("region", "eu"));
        engine.ingest("latency", 90, "org-a", NOW, Map.of("region", "us"));

        assertThat(engine.windowStats("latency", "org-a", 5, Map.of("region", "us")).getAvg()).isEqualTo(90.0);
        assertThat(engine.windowStats("latency", "org-a", 5).getAvg()).isEqualTo(50.0);
        assertThat(engine.trackedMetrics()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject blank names, non-finite values and empty windows")
    void shouldValidateInput() {
        assertThatThrownBy(() -> engine.ingest("", 1, "org-a", null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("metric_name");
        assertThatThrownBy(() -> engine.ingest("cpu", 1, " ", null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("organization_id");
        assertThatThrownBy(() -> engine.ingest("cpu", Double.NaN, "org-a", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.windowStats("cpu", "org-a", 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should notify subscribers and survive a failing one")
    void shouldIsolateSubscriberFailures() {
        List<MetricPoint> seen = new ArrayList<>();
        engine.subscribe("cpu_usage", p -> {
            throw new IllegalStateException("boom");
        });
        engine.subscribe("cpu_usage", seen::add);

        engine.ingest("cpu_usage", 42, "org-a", NOW, null);

        assertThat(seen).singleElement().extracting(MetricPoint::getValue).isEqualTo(42.0);
        assertThat(engine.bufferSize("cpu_usage", "org-a")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should evict points older than the live retention")
    void shouldEvictByAge() {
        engine.ingest("cpu_usage", 1, "org-a", NOW.minus(Duration.ofHours(30)), null);
        engine.ingest("cpu_usage", 2, "org-a", NOW.minus(Duration.ofHours(1)), null);

        long removed = engine.evictOlderThan(Duration.ofHours(24));

        assertThat(removed).isEqualTo(1);
        assertThat(engine.bufferedPoints()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept concurrent ingest for many keys without losing points")
    void shouldIngestConcurrently() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            String org = "org-" + t;
            pool.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    engine.ingest("cpu_usage", i, org, NOW, null);
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(engine.trackedMetrics()).isEqualTo(8);
        assertThat(engine.bufferedPoints()).isEqualTo(400);
    }
}
