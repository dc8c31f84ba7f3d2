package com.pulsewatch.core.alert;

import com.pulsewatch.core.model.AlertEvaluation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory record of alert evaluations.
 *
 * <p>
 * Keeps the most recent {@code capacity} evaluations; older entries are
 * dropped but still counted in {@link #totalRecorded()}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertAuditLog {

    private final int capacity;
    private final Deque<AlertEvaluation> entries = new ArrayDeque<>();
    private long totalRecorded;

    public AlertAuditLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void record(AlertEvaluation evaluation) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(evaluation);
        totalRecorded++;
    }

    /**
     * Most recent evaluations, newest last.
     */
    public synchronized List<AlertEvaluation> recent(int limit) {
        List<AlertEvaluation> out = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<AlertEvaluation> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(0, it.next());
        }
        return out;
    }

    public synchronized List<AlertEvaluation> forAlert(String alertId) {
        return entries.stream()
                .filter(e -> e.getAlertId().equals(alertId))
                .toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long totalRecorded() {
        return totalRecorded;
    }

    public int getCapacity() {
        return capacity;
    }
}
