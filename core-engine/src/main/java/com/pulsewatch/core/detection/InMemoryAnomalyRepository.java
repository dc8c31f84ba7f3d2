package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.Anomaly;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-resident {@link AnomalyRepository}.
 *
 * <p>
 * Writes are serialised so the id index and the deduplication index always
 * agree; reads go straight to the concurrent maps.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final ConcurrentMap<String, Anomaly> byId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idByDedupKey = new ConcurrentHashMap<>();

    @Override
    public synchronized Anomaly putIfAbsent(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        String existingId = idByDedupKey.get(anomaly.dedupKey());
        if (existingId != null) {
            return byId.get(existingId);
        }
        idByDedupKey.put(anomaly.dedupKey(), anomaly.getId());
        byId.put(anomaly.getId(), anomaly);
        return null;
    }

    @Override
    public synchronized boolean replace(Anomaly expected, Anomaly updated) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(updated, "updated must not be null");
        if (!expected.getId().equals(updated.getId())) {
            throw new IllegalArgumentException("replacement must keep id " + expected.getId());
        }
        return byId.replace(expected.getId(), expected, updated);
    }

    @Override
    public Optional<Anomaly> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<Anomaly> findByOrganization(String organizationId, Instant since) {
        return byId.values().stream()
                .filter(a -> a.getOrganizationId().equals(organizationId))
                .filter(a -> since == null || !a.getTimestamp().isBefore(since))
                .sorted(Comparator.comparing(Anomaly::getTimestamp).thenComparing(Anomaly::getMetricName))
                .toList();
    }

    @Override
    public long count() {
        return byId.size();
    }
}
