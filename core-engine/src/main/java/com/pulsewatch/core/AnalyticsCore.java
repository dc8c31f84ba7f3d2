package com.pulsewatch.core;

import com.pulsewatch.core.aggregation.AggregationPipeline;
import com.pulsewatch.core.alert.AlertListener;
import com.pulsewatch.core.alert.AlertManager;
import com.pulsewatch.core.config.EngineSettings;
import com.pulsewatch.core.config.RulesConfig;
import com.pulsewatch.core.detection.AnomalyDetectionEngine;
import com.pulsewatch.core.detection.InMemoryAnomalyRepository;
import com.pulsewatch.core.model.AggregationRule;
import com.pulsewatch.core.model.Alert;
import com.pulsewatch.core.model.Anomaly;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.DetectionRule;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.storage.MetricQuery;
import com.pulsewatch.core.storage.TimeSeriesStore;
import com.pulsewatch.core.util.NamedThreadFactory;
import com.pulsewatch.core.window.DurabilityForwarder;
import com.pulsewatch.core.window.RealTimeWindowEngine;
import com.pulsewatch.core.window.WindowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the analytics components together and runs their background work.
 *
 * <h3>Components</h3>
 * <ul>
 *   <li>{@link RealTimeWindowEngine} with a {@link DurabilityForwarder} into the store</li>
 *   <li>{@link AggregationPipeline} over the store</li>
 *   <li>{@link AnomalyDetectionEngine} over the store and the live windows</li>
 *   <li>{@link AlertManager} over the live windows, also fed by recorded anomalies</li>
 * </ul>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} schedules aggregation ticks, detection sweeps, alert
 * ticks, live-window eviction and daily store retention. {@link #close()}
 * stops the schedulers first, then drains the aggregation workers and
 * finally flushes pending durable writes.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsCore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsCore.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    private static final long ALERT_TICK_MILLIS = 1000;

    /** Aggregation tick, detection sweep, live eviction and store retention. */
    private static final int MAINTENANCE_TASKS = 4;

    private final EngineSettings settings;
    private final TimeSeriesStore store;
    private final Clock clock;

    private final DurabilityForwarder forwarder;
    private final RealTimeWindowEngine windowEngine;
    private final AggregationPipeline aggregationPipeline;
    private final AnomalyDetectionEngine detectionEngine;
    private final AlertManager alertManager;

    private ScheduledExecutorService scheduler;
    private ScheduledExecutorService alertScheduler;
    private volatile boolean closed;

    /**
     * @throws IllegalStateException if {@code settings} are invalid
     */
    public AnalyticsCore(EngineSettings settings, TimeSeriesStore store, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        settings.validate();

        this.forwarder = new DurabilityForwarder(store, settings.storageRetryPolicy(),
                settings.getDurabilityBatchSize(), settings.getDurabilityQueueCapacity());
        this.windowEngine = new RealTimeWindowEngine(settings.getMaxPointsPerMetric(), forwarder, clock);
        this.aggregationPipeline = new AggregationPipeline(store, settings.getAggregationWorkers(),
                settings.getAggregationMaxInFlight(), settings.aggregationRetryPolicy(),
                settings.getAggregationLookbackBuckets(), clock);
        this.detectionEngine = new AnomalyDetectionEngine(store, windowEngine, new InMemoryAnomalyRepository(),
                settings.getSeverityBands(), clock);
        this.alertManager = new AlertManager(windowEngine, settings.getAlertAuditCapacity(),
                Duration.ofSeconds(settings.getAlertMaxTickSeconds()), settings.getAnomalyAlertMinSeverity(), clock);
        detectionEngine.addListener(alertManager);
        LOG.info("Analytics core created: {}", settings);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Analytics core is closed");
        }
        if (scheduler != null) {
            return;
        }
        forwarder.start();
        // alert ticks never share a thread with maintenance tasks
        alertScheduler = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory("pulsewatch-alerts", true));
        scheduler = Executors.newScheduledThreadPool(MAINTENANCE_TASKS,
                new NamedThreadFactory("pulsewatch-scheduler", true));

        schedule(alertScheduler, "alert tick", alertManager::tick, ALERT_TICK_MILLIS);
        schedule(scheduler, "aggregation tick", aggregationPipeline::tick,
                settings.getAggregationTickSeconds() * 1000L);
        schedule(scheduler, "detection sweep", detectionEngine::runSweep,
                settings.getDetectionIntervalSeconds() * 1000L);
        schedule(scheduler, "live eviction", () -> windowEngine.evictOlderThan(
                Duration.ofHours(settings.getLiveRetentionHours())), Duration.ofMinutes(1).toMillis());
        schedule(scheduler, "store retention", this::purgeExpired, Duration.ofDays(1).toMillis());
        LOG.info("Analytics core started");
    }

    private static void schedule(ScheduledExecutorService executor, String name, Runnable task,
            long periodMillis) {
        executor.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Background task '{}' failed: {}", name, e.getMessage(), e);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Delete stored points older than the retention period.
     *
     * @return number of points removed
     */
    public long purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.getStoreRetentionDays()));
        long removed = store.purgeOlderThan(cutoff);
        LOG.debug("Retention purge before {} removed {} point(s)", cutoff, removed);
        return removed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Shutting down analytics core...");
        stop(alertScheduler);
        stop(scheduler);
        aggregationPipeline.shutdown(SHUTDOWN_TIMEOUT);
        forwarder.close();
        LOG.info("Analytics core stopped: {}", health());
    }

    private static void stop(ScheduledExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------

    public MetricPoint ingest(String metricName, double value, String organizationId,
            Instant timestamp, Map<String, String> tags) {
        return windowEngine.ingest(metricName, value, organizationId, timestamp, tags);
    }

    public MetricPoint ingest(MetricPoint point) {
        return windowEngine.ingest(point);
    }

    public List<MetricPoint> query(MetricQuery query) {
        return store.query(query);
    }

    public WindowStats windowStats(String metricName, String organizationId, int windowMinutes) {
        return windowEngine.windowStats(metricName, organizationId, windowMinutes);
    }

    public String addAggregationRule(AggregationRule rule) {
        return aggregationPipeline.addRule(rule);
    }

    public String addDetectionRule(DetectionRule rule) {
        return detectionEngine.addDetectionRule(rule);
    }

    public List<Anomaly> detect(String metricName, String organizationId, int timeWindowHours,
            DetectionMethod method) {
        return detectionEngine.detect(metricName, organizationId, timeWindowHours, method);
    }

    public boolean resolveAnomaly(String anomalyId, String resolutionNote, String resolvedBy) {
        return detectionEngine.resolveAnomaly(anomalyId, resolutionNote, resolvedBy);
    }

    public String configureAlert(Alert alert) {
        return alertManager.configureAlert(alert);
    }

    public void addAlertListener(AlertListener listener) {
        alertManager.addListener(listener);
    }

    /**
     * Register every rule and alert of a loaded configuration. The
     * configuration's engine section is not applied here; it is read when
     * the core is constructed.
     */
    public void applyRules(RulesConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        config.getAggregationRules().forEach(aggregationPipeline::addRule);
        config.getDetectionRules().forEach(detectionEngine::addDetectionRule);
        config.getAlerts().forEach(alertManager::configureAlert);
        LOG.info("Applied {} aggregation rule(s), {} detection rule(s), {} alert(s)",
                config.getAggregationRules().size(), config.getDetectionRules().size(), config.getAlerts().size());
    }

    public HealthSnapshot health() {
        return new HealthSnapshot(
                windowEngine.trackedMetrics(),
                windowEngine.bufferedPoints(),
                aggregationPipeline.pendingJobs(),
                alertManager.activeAlertCount(),
                windowEngine.ingestedTotal(),
                forwarder.pending(),
                forwarder.isDegraded(),
                aggregationPipeline.terminalFailures().size(),
                detectionEngine.recordedAnomalies());
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public EngineSettings getSettings() {
        return settings;
    }

    public TimeSeriesStore getStore() {
        return store;
    }

    public RealTimeWindowEngine getWindowEngine() {
        return windowEngine;
    }

    public AggregationPipeline getAggregationPipeline() {
        return aggregationPipeline;
    }

    public AnomalyDetectionEngine getDetectionEngine() {
        return detectionEngine;
    }

    public AlertManager getAlertManager() {
        return alertManager;
    }

    public DurabilityForwarder getDurabilityForwarder() {
        return forwarder;
    }
}
