package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.Anomaly;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of anomaly records. Records are never deleted.
 *
 * @since 1.0.0
 */
public interface AnomalyRepository {

    /**
     * Store {@code anomaly} unless a record with the same
     * {@link Anomaly#dedupKey()} exists.
     *
     * @return the existing record, or {@code null} if {@code anomaly} was
     *         stored
     */
    Anomaly putIfAbsent(Anomaly anomaly);

    /**
     * Replace {@code expected} with {@code updated} if the stored record is
     * still {@code expected}.
     *
     * @return {@code true} if the record was replaced
     */
    boolean replace(Anomaly expected, Anomaly updated);

    Optional<Anomaly> findById(String id);

    /**
     * Anomalies of one organization whose observation time is at or after
     * {@code since}, ascending by timestamp.
     */
    List<Anomaly> findByOrganization(String organizationId, Instant since);

    long count();
}
