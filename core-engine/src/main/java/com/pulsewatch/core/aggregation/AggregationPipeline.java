package com.pulsewatch.core.aggregation;

import com.pulsewatch.core.error.JobException;
import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.AggregatedPoint;
import com.pulsewatch.core.model.AggregationRule;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.storage.MetricQuery;
import com.pulsewatch.core.storage.TimeSeriesStore;
import com.pulsewatch.core.util.NamedThreadFactory;
import com.pulsewatch.core.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolls raw points up into multi-level aggregates on a schedule.
 *
 * <h3>Scheduling</h3>
 * <p>
 * Every {@link #tick()} creates a job for each of the last
 * {@code lookbackBuckets} completed buckets of every enabled rule, unless a
 * job for that bucket already exists, and then dispatches runnable jobs. A
 * completed job inside the lookback is released again when points arrived
 * for its bucket after it ran. Jobs older than the lookback, and jobs of
 * removed rules, are pruned. A
 * semaphore caps the number of jobs in flight; jobs beyond the ceiling stay
 * queued until a slot frees up.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * A failed job is retried after an exponential backoff delay taken from the
 * {@link RetryPolicy}. Once its attempts are exhausted it becomes
 * {@link JobStatus#FAILED_TERMINAL}, is logged at error level and stays
 * visible through {@link #terminalFailures()}.
 * </p>
 *
 * <h3>Idempotence</h3>
 * <p>
 * A bucket is recomputed from the raw points every time and written with
 * {@link TimeSeriesStore#upsertAggregate}, so reprocessing it yields the same
 * stored value.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);

    private final TimeSeriesStore store;
    private final RetryPolicy retryPolicy;
    private final int lookbackBuckets;
    private final Clock clock;
    private final ExecutorService workers;
    private final Semaphore inFlight;

    private final ConcurrentMap<String, AggregationRule> rules = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AggregationJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong pointsProcessed = new AtomicLong();

    private volatile boolean shuttingDown;

    /**
     * @param store           raw-point source and rollup sink
     * @param workerCount     size of the worker pool
     * @param maxInFlight     ceiling on concurrently running jobs
     * @param retryPolicy     attempt bound and backoff between attempts
     * @param lookbackBuckets completed buckets revisited per tick
     * @param clock           source of "now"
     */
    public AggregationPipeline(TimeSeriesStore store, int workerCount, int maxInFlight,
            RetryPolicy retryPolicy, int lookbackBuckets, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (workerCount < 1 || maxInFlight < 1 || lookbackBuckets < 1) {
            throw new IllegalArgumentException("workerCount, maxInFlight and lookbackBuckets must be >= 1");
        }
        this.lookbackBuckets = lookbackBuckets;
        this.inFlight = new Semaphore(maxInFlight);
        this.workers = Executors.newFixedThreadPool(workerCount,
                new NamedThreadFactory("pulsewatch-aggregation", true));
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * Register or replace a rule. The pipeline keeps its own copy, so later
     * changes to {@code rule} have no effect until it is registered again.
     *
     * @return the rule id ({@code org:source:target:LEVEL})
     * @throws ValidationException if the rule is invalid
     */
    public String addRule(AggregationRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        rule.validate();
        AggregationRule registered = rule.copy();
        String id = registered.getId();
        rules.put(id, registered);
        LOG.info("Registered aggregation rule {} ({}, enabled={})", id, registered.getFunction(), registered.isEnabled());
        return id;
    }

    /**
     * Unregister a rule and forget its jobs. A job already running finishes
     * and is pruned on the next {@link #tick()}.
     */
    public boolean removeRule(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            int dropped = pruneOrphans();
            LOG.info("Removed aggregation rule {} and {} of its job(s)", ruleId, dropped);
        }
        return removed;
    }

    public Optional<AggregationRule> rule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId)).map(AggregationRule::copy);
    }

    public List<AggregationRule> rules() {
        return rules.values().stream().map(AggregationRule::copy).toList();
    }

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------

    /**
     * Enqueue the due buckets of every enabled rule and dispatch runnable
     * jobs. A completed lookback bucket whose raw point count has grown since
     * it ran is enqueued again, so late points reach the rollup.
     */
    public void tick() {
        if (shuttingDown) {
            return;
        }
        Instant now = clock.instant();
        for (AggregationRule rule : rules.values()) {
            Instant bucket = rule.getLevel().bucketStart(now);
            for (int i = 0; i < lookbackBuckets; i++) {
                bucket = rule.getLevel().previousBucketStart(bucket);
                if (rule.isEnabled()) {
                    releaseIfLatePoints(rule, bucket);
                    enqueue(rule, bucket, now);
                }
            }
            pruneCompleted(rule, bucket);
        }
        pruneOrphans();
        dispatch();
    }

    /**
     * Enqueue one job per bucket of {@code ruleId} whose start lies in
     * {@code [from, to)}.
     *
     * @return number of jobs enqueued
     */
    public int backfill(String ruleId, Instant from, Instant to) {
        AggregationRule rule = requireRule(ruleId);
        Instant now = clock.instant();
        int enqueued = 0;
        for (Instant b = rule.getLevel().bucketStart(from); b.isBefore(to); b = rule.getLevel().bucketEnd(b)) {
            AggregationJob job = jobs.get(AggregationJob.idOf(ruleId, b));
            if (job != null && job.getStatus() == JobStatus.COMPLETED) {
                // explicit backfill recomputes completed buckets
                jobs.remove(job.getId(), job);
            }
            if (enqueue(rule, b, now)) {
                enqueued++;
            }
        }
        LOG.info("Backfill of {} enqueued {} job(s) for [{}, {})", ruleId, enqueued, from, to);
        dispatch();
        return enqueued;
    }

    private boolean enqueue(AggregationRule rule, Instant bucketStart, Instant now) {
        String id = AggregationJob.idOf(rule.getId(), bucketStart);
        AggregationJob created = new AggregationJob(rule.getId(), bucketStart, rule.getLevel(), now);
        return jobs.putIfAbsent(id, created) == null;
    }

    /**
     * Drop the completed job of {@code bucketStart} when the store now holds
     * more raw points for that bucket than the job read.
     */
    private void releaseIfLatePoints(AggregationRule rule, Instant bucketStart) {
        AggregationJob job = jobs.get(AggregationJob.idOf(rule.getId(), bucketStart));
        if (job == null || job.getStatus() != JobStatus.COMPLETED || job.getResult() == null) {
            return;
        }
        long read = job.getResult().getPointsRead();
        long current;
        try {
            current = store.query(rawPoints(rule, bucketStart)).size();
        } catch (RuntimeException e) {
            LOG.warn("Could not recount bucket {} of rule {}: {}", bucketStart, rule.getId(), e.getMessage());
            return;
        }
        if (current > read && jobs.remove(job.getId(), job)) {
            LOG.debug("Bucket {} of rule {} gained {} late point(s), recomputing",
                    bucketStart, rule.getId(), current - read);
        }
    }

    private void pruneCompleted(AggregationRule rule, Instant oldestTracked) {
        jobs.values().removeIf(j -> j.getRuleId().equals(rule.getId())
                && j.getStatus() == JobStatus.COMPLETED
                && j.getBucketStart().isBefore(oldestTracked));
    }

    /**
     * Remove every job whose rule is no longer registered, except running
     * ones.
     *
     * @return number of jobs removed
     */
    private int pruneOrphans() {
        int before = jobs.size();
        jobs.values().removeIf(j -> !rules.containsKey(j.getRuleId()) && j.getStatus() != JobStatus.RUNNING);
        return Math.max(0, before - jobs.size());
    }

    /**
     * Start as many runnable jobs as the in-flight ceiling allows.
     */
    synchronized void dispatch() {
        if (shuttingDown) {
            return;
        }
        Instant now = clock.instant();
        List<AggregationJob> runnable = jobs.values().stream()
                .filter(j -> j.isRunnable(now))
                .sorted(Comparator.comparing(AggregationJob::getBucketStart)
                        .thenComparing(AggregationJob::getRuleId))
                .toList();
        for (AggregationJob job : runnable) {
            if (!inFlight.tryAcquire()) {
                LOG.debug("In-flight ceiling reached, {} job(s) stay queued", runnable.size());
                return;
            }
            job.markRunning();
            try {
                workers.execute(() -> execute(job));
            } catch (RejectedExecutionException e) {
                inFlight.release();
                job.markInterrupted(now);
                LOG.warn("Aggregation job {} rejected by worker pool: {}", job.getId(), e.getMessage());
                return;
            }
        }
    }

    private void execute(AggregationJob job) {
        try {
            AggregationRule rule = rules.get(job.getRuleId());
            if (rule == null) {
                jobs.remove(job.getId(), job);
                LOG.debug("Aggregation job {} dropped: rule {} no longer exists", job.getId(), job.getRuleId());
                return;
            }
            AggregationResult result = aggregateBucket(rule, job.getBucketStart());
            job.markCompleted(result);
            pointsProcessed.addAndGet(result.getPointsRead());
            LOG.debug("Aggregation job {} completed: {}", job.getId(), result);
        } catch (RuntimeException e) {
            onFailure(job, e);
        } finally {
            inFlight.release();
        }
        dispatch();
    }

    private void onFailure(AggregationJob job, RuntimeException cause) {
        int attempt = job.getAttempts();
        JobException failure = new JobException(job.getId(), attempt, cause.getMessage(), cause);
        if (attempt >= retryPolicy.getMaxAttempts()) {
            job.markFailed(failure.getMessage(), true, clock.instant());
            LOG.error("Aggregation job {} failed terminally after {} attempt(s)", job.getId(), attempt, failure);
        } else {
            Duration delay = retryPolicy.delayAfter(attempt);
            job.markFailed(failure.getMessage(), false, clock.instant().plus(delay));
            LOG.warn("Aggregation job {} failed (attempt {}/{}), retrying in {} ms: {}",
                    job.getId(), attempt, retryPolicy.getMaxAttempts(), delay.toMillis(), cause.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Synchronous execution
    // ---------------------------------------------------------------

    /**
     * Aggregate the bucket containing {@code bucketStart} on the calling
     * thread.
     *
     * @throws JobException if reading or writing fails
     */
    public AggregationResult runNow(String ruleId, Instant bucketStart) {
        AggregationRule rule = requireRule(ruleId);
        Instant aligned = rule.getLevel().bucketStart(bucketStart);
        try {
            AggregationResult result = aggregateBucket(rule, aligned);
            pointsProcessed.addAndGet(result.getPointsRead());
            return result;
        } catch (RuntimeException e) {
            throw new JobException(AggregationJob.idOf(ruleId, aligned), 1, e.getMessage(), e);
        }
    }

    /**
     * Compute and upsert every tag group of one bucket.
     */
    AggregationResult aggregateBucket(AggregationRule rule, Instant bucketStart) {
        List<MetricPoint> points = store.query(rawPoints(rule, bucketStart));

        Map<Map<String, String>, List<MetricPoint>> groups = groupByTags(points, rule.getGroupByTags());
        int written = 0;
        for (Map.Entry<Map<String, String>, List<MetricPoint>> e : groups.entrySet()) {
            List<MetricPoint> members = e.getValue();
            double[] values = new double[members.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = members.get(i).getValue();
            }
            store.upsertAggregate(AggregatedPoint.builder()
                    .bucketStart(bucketStart)
                    .level(rule.getLevel())
                    .metricName(rule.getTargetMetric())
                    .organizationId(rule.getOrganizationId())
                    .groupTags(e.getKey())
                    .value(rule.getFunction().apply(values, rule.getPercentile()))
                    .countContributingPoints(values.length)
                    .build());
            written++;
        }
        return new AggregationResult(rule.getId(), bucketStart, points.size(), written);
    }

    /**
     * Partition points by their values of {@code groupByTags}; a missing tag
     * groups under the empty string.
     */
    private static Map<Map<String, String>, List<MetricPoint>> groupByTags(List<MetricPoint> points,
            List<String> groupByTags) {
        Map<Map<String, String>, List<MetricPoint>> groups = new LinkedHashMap<>();
        for (MetricPoint p : points) {
            Map<String, String> key = new TreeMap<>();
            for (String tag : groupByTags) {
                key.put(tag, p.getTags().getOrDefault(tag, ""));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }
        return groups;
    }

    private static MetricQuery rawPoints(AggregationRule rule, Instant bucketStart) {
        return MetricQuery.builder(rule.getSourceMetric(), rule.getOrganizationId())
                .range(bucketStart, rule.getLevel().bucketEnd(bucketStart))
                .build();
    }

    private AggregationRule requireRule(String ruleId) {
        AggregationRule rule = rules.get(ruleId);
        if (rule == null) {
            throw new ValidationException("Unknown aggregation rule: " + ruleId);
        }
        return rule;
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public Optional<AggregationJob> job(String ruleId, Instant bucketStart) {
        return Optional.ofNullable(jobs.get(AggregationJob.idOf(ruleId, bucketStart)));
    }

    public List<AggregationJob> terminalFailures() {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.FAILED_TERMINAL)
                .sorted(Comparator.comparing(AggregationJob::getBucketStart))
                .toList();
    }

    /**
     * Jobs not yet done: pending, running or awaiting retry.
     */
    public int pendingJobs() {
        return (int) jobs.values().stream().filter(j -> !j.getStatus().isDone()).count();
    }

    public PipelineStats stats() {
        int pending = 0;
        int running = 0;
        int completed = 0;
        int retryable = 0;
        int terminal = 0;
        for (AggregationJob job : jobs.values()) {
            switch (job.getStatus()) {
                case PENDING -> pending++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED_RETRYABLE -> retryable++;
                case FAILED_TERMINAL -> terminal++;
            }
        }
        int active = (int) rules.values().stream().filter(AggregationRule::isEnabled).count();
        return new PipelineStats(active, pending, running, completed, retryable, terminal, pointsProcessed.get());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Stop dispatching, wait up to {@code timeout} for running jobs, and hand
     * any job still running back to the retry state.
     */
    public void shutdown(Duration timeout) {
        synchronized (this) {
            shuttingDown = true;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Aggregation workers did not finish within {} ms", timeout.toMillis());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        Instant now = clock.instant();
        for (AggregationJob job : jobs.values()) {
            job.markInterrupted(now);
        }
        LOG.info("Aggregation pipeline stopped: {}", stats());
    }
}
