package com.pulsewatch.core.window;

import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live ingestion and sliding-window statistics.
 *
 * <p>
 * Each {@code (organizationId, metricName)} key owns one {@link WindowBuffer},
 * created lazily on first ingest. Ingest calls for different keys share no
 * lock; calls for the same key serialise only on that buffer's append.
 * Every accepted point is also offered to the {@link DurabilityForwarder},
 * whose failures never reach the caller.
 * </p>
 *
 * <h3>Reads</h3>
 * <p>
 * {@link #windowStats} scans the buffer for points no older than the
 * requested window. A tag filter narrows the scan over the same buffer; tags
 * never create additional buffers.
 * </p>
 *
 * @since 1.0.0
 */
public class RealTimeWindowEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RealTimeWindowEngine.class);

    private final int maxPointsPerMetric;
    private final DurabilityForwarder forwarder;
    private final Clock clock;

    private final ConcurrentMap<BufferKey, WindowBuffer> buffers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<MetricSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong ingested = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    /**
     * @param maxPointsPerMetric buffer capacity per key
     * @param forwarder          durability hand-off, {@code null} for a
     *                           live-only engine
     * @param clock              source of "now" for default timestamps and
     *                           window bounds
     */
    public RealTimeWindowEngine(int maxPointsPerMetric, DurabilityForwarder forwarder, Clock clock) {
        if (maxPointsPerMetric < 1) {
            throw new IllegalArgumentException("maxPointsPerMetric must be >= 1, got: " + maxPointsPerMetric);
        }
        this.maxPointsPerMetric = maxPointsPerMetric;
        this.forwarder = forwarder;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Ingest one observation.
     *
     * @param timestamp observation time, {@code null} for now
     * @param tags      optional tags, may be {@code null}
     * @return the buffered point
     * @throws ValidationException if a name is blank or the value is not finite
     */
    public MetricPoint ingest(String metricName, double value, String organizationId,
            Instant timestamp, Map<String, String> tags) {
        requireName(metricName, "metric_name");
        requireName(organizationId, "organization_id");
        requireFinite(value);
        MetricPoint point = MetricPoint.builder()
                .metricName(metricName)
                .organizationId(organizationId)
                .value(value)
                .timestamp(timestamp != null ? timestamp : clock.instant())
                .tags(tags)
                .build();
        accept(point);
        return point;
    }

    /**
     * Ingest a pre-built point.
     *
     * @throws ValidationException if a name is blank or the value is not finite
     */
    public MetricPoint ingest(MetricPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        requireName(point.getMetricName(), "metric_name");
        requireName(point.getOrganizationId(), "organization_id");
        requireFinite(point.getValue());
        accept(point);
        return point;
    }

    private void accept(MetricPoint point) {
        WindowBuffer buffer = buffers.computeIfAbsent(BufferKey.of(point), k -> {
            LOG.debug("Tracking new metric {}/{}", k.organizationId, k.metricName);
            return new WindowBuffer(maxPointsPerMetric);
        });
        if (buffer.append(point)) {
            evicted.incrementAndGet();
        }
        ingested.incrementAndGet();

        if (forwarder != null) {
            forwarder.offer(point);
        }
        notifySubscribers(point);
    }

    private void notifySubscribers(MetricPoint point) {
        List<MetricSubscriber> subs = subscribers.get(point.getMetricName());
        if (subs == null) {
            return;
        }
        for (MetricSubscriber sub : subs) {
            try {
                sub.onPoint(point);
            } catch (RuntimeException e) {
                LOG.warn("Subscriber for metric '{}' failed: {}", point.getMetricName(), e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public WindowStats windowStats(String metricName, String organizationId, int windowMinutes) {
        return windowStats(metricName, organizationId, windowMinutes, null);
    }

    /**
     * Statistics over points with {@code timestamp >= now - windowMinutes}.
     *
     * @param tagFilter optional tag view over the same buffer
     * @return stats with {@code count == 0} when nothing is in the window
     */
    public WindowStats windowStats(String metricName, String organizationId, int windowMinutes,
            Map<String, String> tagFilter) {
        List<MetricPoint> points = windowPoints(metricName, organizationId, windowMinutes, tagFilter);
        return WindowStats.of(points, windowMinutes);
    }

    public List<MetricPoint> windowPoints(String metricName, String organizationId, int windowMinutes) {
        return windowPoints(metricName, organizationId, windowMinutes, null);
    }

    /**
     * Buffered points of the window, oldest first.
     */
    public List<MetricPoint> windowPoints(String metricName, String organizationId, int windowMinutes,
            Map<String, String> tagFilter) {
        if (windowMinutes < 1) {
            throw new ValidationException("window_minutes must be >= 1, got: " + windowMinutes);
        }
        WindowBuffer buffer = buffers.get(new BufferKey(organizationId, metricName));
        if (buffer == null) {
            return List.of();
        }
        Instant since = clock.instant().minus(Duration.ofMinutes(windowMinutes));
        return buffer.snapshot(since, tagFilter);
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    public void subscribe(String metricName, MetricSubscriber subscriber) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        subscribers.computeIfAbsent(metricName, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        LOG.info("Subscribed to metric '{}'", metricName);
    }

    public boolean unsubscribe(String metricName, MetricSubscriber subscriber) {
        List<MetricSubscriber> subs = subscribers.get(metricName);
        return subs != null && subs.remove(subscriber);
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Clear the buffer of one key.
     *
     * @return {@code true} if the key was tracked
     */
    public boolean resetBuffer(String metricName, String organizationId) {
        WindowBuffer buffer = buffers.get(new BufferKey(organizationId, metricName));
        if (buffer == null) {
            return false;
        }
        buffer.clear();
        LOG.info("Reset live buffer {}/{}", organizationId, metricName);
        return true;
    }

    /**
     * Drop live points older than {@code retention}.
     *
     * @return number of points removed across all buffers
     */
    public long evictOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        long removed = 0;
        for (WindowBuffer buffer : buffers.values()) {
            removed += buffer.evictOlderThan(cutoff);
        }
        if (removed > 0) {
            evicted.addAndGet(removed);
            LOG.debug("Evicted {} live point(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    public int bufferSize(String metricName, String organizationId) {
        WindowBuffer buffer = buffers.get(new BufferKey(organizationId, metricName));
        return buffer == null ? 0 : buffer.size();
    }

    public int trackedMetrics() {
        return buffers.size();
    }

    public long bufferedPoints() {
        long total = 0;
        for (WindowBuffer buffer : buffers.values()) {
            total += buffer.size();
        }
        return total;
    }

    public long ingestedTotal() {
        return ingested.get();
    }

    public long evictedTotal() {
        return evicted.get();
    }

    public int getMaxPointsPerMetric() {
        return maxPointsPerMetric;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
    }

    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException("value must be finite, got: " + value);
        }
    }

    private static final class BufferKey {
        private final String organizationId;
        private final String metricName;

        BufferKey(String organizationId, String metricName) {
            this.organizationId = organizationId;
            this.metricName = metricName;
        }

        static BufferKey of(MetricPoint point) {
            return new BufferKey(point.getOrganizationId(), point.getMetricName());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof BufferKey that))
                return false;
            return Objects.equals(organizationId, that.organizationId)
                    && Objects.equals(metricName, that.metricName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(organizationId, metricName);
        }
    }
}
