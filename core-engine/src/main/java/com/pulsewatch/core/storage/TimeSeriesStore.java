package com.pulsewatch.core.storage;

import com.pulsewatch.core.error.StorageException;
import com.pulsewatch.core.model.AggregatedPoint;
import com.pulsewatch.core.model.AggregationFunction;
import com.pulsewatch.core.model.AggregationLevel;
import com.pulsewatch.core.model.MetricPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Durable, queryable home of metric history and rollups.
 *
 * <h3>Tenant isolation</h3>
 * <p>
 * Every read and write is scoped by organization id. An implementation must
 * never return data written under a different organization, whatever tag
 * filters are supplied.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Any backend outage or timeout surfaces as a {@link StorageException}, which
 * callers may retry with backoff. Empty result sets are never an error.
 * </p>
 *
 * @since 1.0.0
 */
public interface TimeSeriesStore {

    /**
     * Append one point.
     *
     * @throws StorageException if the backend is unavailable
     */
    void write(MetricPoint point);

    /**
     * Append a batch of points. Either all points are accepted or a
     * {@link StorageException} is thrown and the caller may resend the batch.
     *
     * @throws StorageException if the backend is unavailable
     */
    void writeBatch(Collection<MetricPoint> points);

    /**
     * Raw or bucketed points for one series, ascending by timestamp.
     *
     * @throws StorageException if the backend is unavailable
     */
    List<MetricPoint> query(MetricQuery query);

    /**
     * Most recent value of the series, optionally restricted to points carrying
     * {@code tags}.
     *
     * @return the value, or empty when the series has no matching point
     */
    OptionalDouble latestValue(String metricName, String organizationId, Map<String, String> tags);

    /**
     * Statistics over the last {@code windowHours} hours.
     *
     * @return {@link MetricStats#empty()} when no point falls in the window
     */
    MetricStats stats(String metricName, String organizationId, int windowHours);

    /**
     * Reduce raw points in {@code [start, end)} to one value per
     * {@code interval}.
     */
    default List<MetricPoint> downsample(String metricName, String organizationId,
            AggregationFunction function, Duration interval, Instant start, Instant end) {
        return query(MetricQuery.builder(metricName, organizationId)
                .range(start, end)
                .aggregation(function)
                .interval(interval)
                .build());
    }

    /**
     * Insert or replace the rollup stored under {@link AggregatedPoint#key()}.
     *
     * @throws StorageException if the backend is unavailable
     */
    void upsertAggregate(AggregatedPoint point);

    /**
     * Rollups of {@code metricName} at {@code level} whose bucket starts in
     * {@code [start, end)}, ascending by bucket start.
     */
    List<AggregatedPoint> queryAggregates(String metricName, String organizationId,
            AggregationLevel level, Instant start, Instant end);

    /**
     * Delete raw points older than {@code cutoff}.
     *
     * @return number of points removed
     */
    long purgeOlderThan(Instant cutoff);
}
