package com.pulsewatch.core.window;

import com.pulsewatch.core.model.MetricPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WindowBuffer}.
 */
class WindowBufferTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should never exceed capacity and evict oldest first")
    void shouldEvictOldestWhenFull() {
        WindowBuffer buffer = new WindowBuffer(3);

        assertThat(buffer.append(point(0, 1))).isFalse();
        assertThat(buffer.append(point(1, 2))).isFalse();
        assertThat(buffer.append(point(2, 3))).isFalse();
        assertThat(buffer.append(point(3, 4))).isTrue();
        assertThat(buffer.append(point(4, 5))).isTrue();

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.snapshot(null, null))
                .extracting(MetricPoint::getValue)
                .containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should snapshot only points inside the window and matching the tag view")
    void shouldFilterSnapshot() {
        WindowBuffer buffer = new WindowBuffer(10);
        buffer.append(point(0, 1));
        buffer.append(MetricPoint.builder().metricName("cpu").organizationId("org-a")
                .timestamp(T0.plusSeconds(60)).value(2).tag("host", "web-1").build());
        buffer.append(MetricPoint.builder().metricName("cpu").organizationId("org-a")
                .timestamp(T0.plusSeconds(120)).value(3).tag("host", "web-2").build());

        assertThat(buffer.snapshot(T0.plusSeconds(60), null)).hasSize(2);
        assertThat(buffer.snapshot(null, Map.of("host", "web-2")))
                .extracting(MetricPoint::getValue)
                .containsExactly(3.0);
    }

    @Test
    @DisplayName("Should evict aged points from the head")
    void shouldEvictAgedPoints() {
        WindowBuffer buffer = new WindowBuffer(10);
        for (int i = 0; i < 5; i++) {
            buffer.append(point(i * 60, i));
        }

        int removed = buffer.evictOlderThan(T0.plusSeconds(150));

        assertThat(removed).isEqualTo(3);
        assertThat(buffer.snapshot(null, null)).extracting(MetricPoint::getValue).containsExactly(3.0, 4.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MetricPoint point(long offsetSeconds, double value) {
        return MetricPoint.builder()
                .metricName("cpu")
                .organizationId("org-a")
                .timestamp(T0.plusSeconds(offsetSeconds))
                .value(value)
                .build();
    }
}
