package com.pulsewatch.core.storage;

import com.pulsewatch.core.model.AggregatedPoint;
import com.pulsewatch.core.model.AggregationFunction;
import com.pulsewatch.core.model.AggregationLevel;
import com.pulsewatch.core.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-resident {@link TimeSeriesStore} for development, tests and
 * single-node deployments.
 *
 * <h3>Layout</h3>
 * <p>
 * One series per {@code (organizationId, metricName)}, each a
 * timestamp-sorted list guarded by its own read/write lock, so writers of
 * different series never contend. Rollups live in a concurrent map keyed by
 * {@link AggregatedPoint.Key}, which makes {@link #upsertAggregate} a plain
 * put.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTimeSeriesStore.class);

    /** Metadata key carrying the number of raw points behind a bucketed value. */
    public static final String POINT_COUNT = "point_count";

    private final Clock clock;
    private final ConcurrentMap<SeriesKey, Series> series = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregatedPoint.Key, AggregatedPoint> aggregates = new ConcurrentHashMap<>();

    public InMemoryTimeSeriesStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTimeSeriesStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    @Override
    public void write(MetricPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        series.computeIfAbsent(SeriesKey.of(point), k -> new Series()).insert(point);
    }

    @Override
    public void writeBatch(Collection<MetricPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        for (MetricPoint point : points) {
            write(point);
        }
    }

    @Override
    public void upsertAggregate(AggregatedPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        AggregatedPoint previous = aggregates.put(point.key(), point);
        if (previous != null && LOG.isTraceEnabled()) {
            LOG.trace("Replaced aggregate {} ({} -> {})", point.key(), previous.getValue(), point.getValue());
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    @Override
    public List<MetricPoint> query(MetricQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Series s = series.get(new SeriesKey(query.getOrganizationId(), query.getMetricName()));
        if (s == null) {
            return List.of();
        }
        List<MetricPoint> matching = s.range(query.getStart(), query.getEnd(), query.getTags());
        List<MetricPoint> result = query.isBucketed() ? bucket(matching, query) : matching;
        return applyLimit(result, query.getLimit());
    }

    @Override
    public OptionalDouble latestValue(String metricName, String organizationId, Map<String, String> tags) {
        Series s = series.get(new SeriesKey(organizationId, metricName));
        return s == null ? OptionalDouble.empty() : s.latest(tags);
    }

    @Override
    public MetricStats stats(String metricName, String organizationId, int windowHours) {
        if (windowHours < 1) {
            throw new IllegalArgumentException("windowHours must be >= 1, got: " + windowHours);
        }
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofHours(windowHours));
        Series s = series.get(new SeriesKey(organizationId, metricName));
        if (s == null) {
            return MetricStats.empty();
        }
        // end is inclusive here so a point stamped "now" is counted
        List<MetricPoint> points = s.range(start, end.plusNanos(1), Map.of());
        return MetricStats.of(values(points), windowHours);
    }

    @Override
    public List<AggregatedPoint> queryAggregates(String metricName, String organizationId,
            AggregationLevel level, Instant start, Instant end) {
        Objects.requireNonNull(level, "level must not be null");
        return aggregates.values().stream()
                .filter(a -> a.getOrganizationId().equals(organizationId))
                .filter(a -> a.getMetricName().equals(metricName))
                .filter(a -> a.getLevel() == level)
                .filter(a -> start == null || !a.getBucketStart().isBefore(start))
                .filter(a -> end == null || a.getBucketStart().isBefore(end))
                .sorted(Comparator.comparing(AggregatedPoint::getBucketStart)
                        .thenComparing(a -> a.getGroupTags().toString()))
                .toList();
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    @Override
    public long purgeOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        long removed = 0;
        for (Series s : series.values()) {
            removed += s.removeBefore(cutoff);
        }
        if (removed > 0) {
            LOG.info("Retention purge removed {} point(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * @return total raw points held across all series
     */
    public long size() {
        return series.values().stream().mapToLong(Series::size).sum();
    }

    public int aggregateCount() {
        return aggregates.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<MetricPoint> bucket(List<MetricPoint> points, MetricQuery query) {
        if (points.isEmpty()) {
            return List.of();
        }
        AggregationFunction function = query.getAggregation() != null
                ? query.getAggregation()
                : AggregationFunction.MEAN;
        Map<Instant, List<MetricPoint>> buckets = new TreeMap<>();
        if (query.getInterval() == null) {
            Instant start = query.getStart() != null ? query.getStart() : points.get(0).getTimestamp();
            buckets.put(start, points);
        } else {
            long width = query.getInterval().toMillis();
            for (MetricPoint p : points) {
                long ms = p.getTimestamp().toEpochMilli();
                Instant bucketStart = Instant.ofEpochMilli(Math.floorDiv(ms, width) * width);
                buckets.computeIfAbsent(bucketStart, k -> new ArrayList<>()).add(p);
            }
        }

        List<MetricPoint> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, List<MetricPoint>> e : buckets.entrySet()) {
            List<MetricPoint> members = e.getValue();
            result.add(MetricPoint.builder()
                    .timestamp(e.getKey())
                    .metricName(query.getMetricName())
                    .organizationId(query.getOrganizationId())
                    .value(function.apply(values(members), query.getPercentile()))
                    .tags(query.getTags())
                    .metadata(POINT_COUNT, members.size())
                    .build());
        }
        return result;
    }

    private static List<MetricPoint> applyLimit(List<MetricPoint> points, int limit) {
        if (limit <= 0 || points.size() <= limit) {
            return points;
        }
        return List.copyOf(points.subList(points.size() - limit, points.size()));
    }

    private static double[] values(List<MetricPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    private static final class SeriesKey {
        private final String organizationId;
        private final String metricName;

        SeriesKey(String organizationId, String metricName) {
            this.organizationId = Objects.requireNonNull(organizationId, "organizationId must not be null");
            this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        }

        static SeriesKey of(MetricPoint point) {
            return new SeriesKey(point.getOrganizationId(), point.getMetricName());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SeriesKey that))
                return false;
            return organizationId.equals(that.organizationId) && metricName.equals(that.metricName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(organizationId, metricName);
        }
    }

    /**
     * Timestamp-ordered points of one series.
     */
    private static final class Series {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final List<MetricPoint> points = new ArrayList<>();

        void insert(MetricPoint point) {
            lock.writeLock().lock();
            try {
                int n = points.size();
                if (n == 0 || !point.getTimestamp().isBefore(points.get(n - 1).getTimestamp())) {
                    points.add(point);
                } else {
                    points.add(upperBound(point.getTimestamp()), point);
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<MetricPoint> range(Instant start, Instant end, Map<String, String> tags) {
            lock.readLock().lock();
            try {
                int from = start == null ? 0 : lowerBound(start);
                int to = end == null ? points.size() : lowerBound(end);
                List<MetricPoint> out = new ArrayList<>(Math.max(0, to - from));
                for (int i = from; i < to; i++) {
                    MetricPoint p = points.get(i);
                    if (p.matchesTags(tags)) {
                        out.add(p);
                    }
                }
                return out;
            } finally {
                lock.readLock().unlock();
            }
        }

        OptionalDouble latest(Map<String, String> tags) {
            lock.readLock().lock();
            try {
                for (int i = points.size() - 1; i >= 0; i--) {
                    MetricPoint p = points.get(i);
                    if (p.matchesTags(tags)) {
                        return OptionalDouble.of(p.getValue());
                    }
                }
                return OptionalDouble.empty();
            } finally {
                lock.readLock().unlock();
            }
        }

        long removeBefore(Instant cutoff) {
            lock.writeLock().lock();
            try {
                int to = lowerBound(cutoff);
                if (to > 0) {
                    points.subList(0, to).clear();
                }
                return to;
            } finally {
                lock.writeLock().unlock();
            }
        }

        long size() {
            lock.readLock().lock();
            try {
                return points.size();
            } finally {
                lock.readLock().unlock();
            }
        }

        /** First index whose timestamp is {@code >= t}. */
        private int lowerBound(Instant t) {
            int lo = 0;
            int hi = points.size();
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (points.get(mid).getTimestamp().isBefore(t)) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }

        /** First index whose timestamp is {@code > t}. */
        private int upperBound(Instant t) {
            int lo = 0;
            int hi = points.size();
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (!points.get(mid).getTimestamp().isAfter(t)) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }
    }
}
