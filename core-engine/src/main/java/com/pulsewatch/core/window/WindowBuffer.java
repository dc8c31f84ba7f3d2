package com.pulsewatch.core.window;

import com.pulsewatch.core.model.MetricPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded ring buffer of the most recent points of one
 * {@code (organizationId, metricName)} key.
 *
 * <p>
 * Points are kept in arrival order. When the buffer is full, appending evicts
 * the oldest point. Writers take the write lock for the O(1) append/evict
 * only; readers scan under the read lock.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowBuffer {

    private final MetricPoint[] ring;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Index of the oldest element. */
    private int head;
    private int size;

    public WindowBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.ring = new MetricPoint[capacity];
    }

    /**
     * Append a point, evicting the oldest one when full.
     *
     * @return {@code true} if a point was evicted
     */
    public boolean append(MetricPoint point) {
        lock.writeLock().lock();
        try {
            if (size == ring.length) {
                ring[head] = point;
                head = (head + 1) % ring.length;
                return true;
            }
            ring[(head + size) % ring.length] = point;
            size++;
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Points with {@code timestamp >= since} that carry every entry of
     * {@code tagFilter}, oldest first.
     *
     * @param since     lower bound, {@code null} for the whole buffer
     * @param tagFilter tag view, {@code null} or empty for all points
     */
    public List<MetricPoint> snapshot(Instant since, Map<String, String> tagFilter) {
        lock.readLock().lock();
        try {
            List<MetricPoint> out = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                MetricPoint p = ring[(head + i) % ring.length];
                if ((since == null || !p.getTimestamp().isBefore(since)) && p.matchesTags(tagFilter)) {
                    out.add(p);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop points from the head while they are older than {@code cutoff}.
     * Eviction stops at the first point that is not, so out-of-order arrivals
     * behind a newer head survive until it ages out.
     *
     * @return number of points removed
     */
    public int evictOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            while (size > 0 && ring[head].getTimestamp().isBefore(cutoff)) {
                ring[head] = null;
                head = (head + 1) % ring.length;
                size--;
                removed++;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            Arrays.fill(ring, null);
            head = 0;
            size = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return ring.length;
    }
}
