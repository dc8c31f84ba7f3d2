package com.pulsewatch.core.window;

import com.pulsewatch.core.error.StorageException;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.storage.TimeSeriesStore;
import com.pulsewatch.core.util.NamedThreadFactory;
import com.pulsewatch.core.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands ingested points to the {@link TimeSeriesStore} off the ingest path.
 *
 * <p>
 * {@link #offer(MetricPoint)} never blocks: points go into a bounded queue
 * drained by one worker thread in batches. Each batch is written with the
 * configured {@link RetryPolicy}. When retries are exhausted the batch is
 * dropped, the forwarder reports itself degraded and live-window reads keep
 * working. A full queue drops the durable copy of the offered point only.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #close()} stops accepting points, lets the worker drain what is
 * queued and waits for it to finish. Points offered after close are refused
 * and counted as dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class DurabilityForwarder implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DurabilityForwarder.class);

    private static final long POLL_MILLIS = 100;
    private static final long SHUTDOWN_WAIT_MILLIS = 30_000;

    private final TimeSeriesStore store;
    private final RetryPolicy retryPolicy;
    private final int batchSize;
    private final BlockingQueue<MetricPoint> queue;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong overflowed = new AtomicLong();
    private final AtomicLong refusedAfterClose = new AtomicLong();

    private Thread worker;

    public DurabilityForwarder(TimeSeriesStore store, RetryPolicy retryPolicy, int batchSize, int queueCapacity) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        this.batchSize = batchSize;
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
    }

    /**
     * Start the worker thread. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (closed.get()) {
            throw new IllegalStateException("Durability forwarder is closed");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        worker = new NamedThreadFactory("pulsewatch-durability", true).newThread(this::drainLoop);
        worker.start();
        LOG.info("Durability forwarder started (batchSize={}, capacity={})",
                batchSize, queue.remainingCapacity() + queue.size());
    }

    /**
     * Queue a point for durable storage.
     *
     * @return {@code false} if the forwarder is closed or the queue was full;
     *         the durable copy of the point is dropped in both cases
     */
    public boolean offer(MetricPoint point) {
        if (closed.get()) {
            long n = refusedAfterClose.incrementAndGet();
            dropped.incrementAndGet();
            if (n == 1 || n % 1000 == 0) {
                LOG.warn("Durability forwarder closed, dropped durable copy of {} point(s) offered since", n);
            }
            return false;
        }
        if (queue.offer(point)) {
            return true;
        }
        long n = overflowed.incrementAndGet();
        dropped.incrementAndGet();
        if (n == 1 || n % 1000 == 0) {
            LOG.warn("Durability queue full, dropped durable copy of {} point(s) so far", n);
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Worker
    // ---------------------------------------------------------------

    private void drainLoop() {
        List<MetricPoint> batch = new ArrayList<>(batchSize);
        while (running.get() || !queue.isEmpty()) {
            try {
                MetricPoint first = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                writeBatch(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Durability worker interrupted with {} point(s) queued", queue.size());
                return;
            } catch (RuntimeException e) {
                LOG.error("Unexpected durability worker failure", e);
            } finally {
                batch.clear();
            }
        }
        LOG.debug("Durability worker finished");
    }

    private void writeBatch(List<MetricPoint> batch) throws InterruptedException {
        List<MetricPoint> copy = List.copyOf(batch);
        try {
            retryPolicy.call(() -> {
                store.writeBatch(copy);
                return null;
            }, e -> e instanceof StorageException);
            persisted.addAndGet(copy.size());
            if (degraded.compareAndSet(true, false)) {
                LOG.info("Durable storage recovered");
            }
        } catch (InterruptedException e) {
            dropped.addAndGet(copy.size());
            throw e;
        } catch (Exception e) {
            dropped.addAndGet(copy.size());
            degraded.set(true);
            LOG.warn("Degraded durability: dropped batch of {} point(s) after {} attempt(s): {}",
                    copy.size(), retryPolicy.getMaxAttempts(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle / introspection
    // ---------------------------------------------------------------

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            closed.set(true);
            if (!running.compareAndSet(true, false)) {
                return;
            }
            t = worker;
        }
        try {
            t.join(SHUTDOWN_WAIT_MILLIS);
            if (t.isAlive()) {
                LOG.warn("Durability worker did not finish within {} ms, {} point(s) still queued",
                        SHUTDOWN_WAIT_MILLIS, queue.size());
                t.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            t.interrupt();
        }
        LOG.info("Durability forwarder stopped (persisted={}, dropped={})", persisted.get(), dropped.get());
    }

    public int pending() {
        return queue.size();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public long persistedTotal() {
        return persisted.get();
    }

    public long droppedTotal() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
