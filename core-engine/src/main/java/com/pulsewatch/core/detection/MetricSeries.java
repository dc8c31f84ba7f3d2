package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.AggregatedPoint;
import com.pulsewatch.core.model.MetricPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An ordered series of values of one metric of one organization, the input of
 * every {@link AnomalyDetector}. A series read from rollups belongs to one
 * tag group; {@link #getTags()} names it.
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String organizationId;
    private final String metricName;
    private final Map<String, String> tags;
    private final Instant[] timestamps;
    private final double[] values;

    public MetricSeries(String organizationId, String metricName, Instant[] timestamps, double[] values) {
        this(organizationId, metricName, Map.of(), timestamps, values);
    }

    public MetricSeries(String organizationId, String metricName, Map<String, String> tags,
            Instant[] timestamps, double[] values) {
        Objects.requireNonNull(tags, "tags must not be null");
        this.tags = tags.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(tags));
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("timestamps and values differ in length: "
                    + timestamps.length + " != " + values.length);
        }
        this.timestamps = timestamps.clone();
        this.values = values.clone();
    }

    public static MetricSeries ofPoints(String organizationId, String metricName, List<MetricPoint> points) {
        Instant[] ts = new Instant[points.size()];
        double[] vs = new double[points.size()];
        for (int i = 0; i < vs.length; i++) {
            ts[i] = points.get(i).getTimestamp();
            vs[i] = points.get(i).getValue();
        }
        return new MetricSeries(organizationId, metricName, ts, vs);
    }

    /**
     * Split rollups into one series per distinct group-tag set, each ascending
     * in the order the points are given.
     */
    public static List<MetricSeries> ofAggregates(String organizationId, String metricName,
            List<AggregatedPoint> points) {
        Map<Map<String, String>, List<AggregatedPoint>> groups = new LinkedHashMap<>();
        for (AggregatedPoint p : points) {
            groups.computeIfAbsent(new TreeMap<>(p.getGroupTags()), k -> new ArrayList<>()).add(p);
        }
        List<MetricSeries> series = new ArrayList<>(groups.size());
        for (Map.Entry<Map<String, String>, List<AggregatedPoint>> e : groups.entrySet()) {
            List<AggregatedPoint> members = e.getValue();
            Instant[] ts = new Instant[members.size()];
            double[] vs = new double[members.size()];
            for (int i = 0; i < vs.length; i++) {
                ts[i] = members.get(i).getBucketStart();
                vs[i] = members.get(i).getValue();
            }
            series.add(new MetricSeries(organizationId, metricName, e.getKey(), ts, vs));
        }
        return series;
    }

    /**
     * The last {@code n} elements, or this series if it is not longer.
     */
    public MetricSeries tail(int n) {
        if (n >= values.length) {
            return this;
        }
        int from = values.length - n;
        return new MetricSeries(organizationId, metricName, tags,
                Arrays.copyOfRange(timestamps, from, timestamps.length),
                Arrays.copyOfRange(values, from, values.length));
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double value(int index) {
        return values[index];
    }

    public Instant timestamp(int index) {
        return timestamps[index];
    }

    /**
     * @return a copy of the values
     */
    public double[] values() {
        return values.clone();
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return group tags, empty for an ungrouped series
     */
    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "MetricSeries{" + organizationId + '/' + metricName
                + (tags.isEmpty() ? "" : tags.toString()) + ", size=" + values.length + '}';
    }
}
