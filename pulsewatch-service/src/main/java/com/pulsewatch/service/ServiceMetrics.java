package com.pulsewatch.service;

import com.pulsewatch.core.AnalyticsCore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters of the Pulsewatch service.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code pulsewatch.messages.ingested} / {@code .rejected}: metric messages accepted or skipped</li>
 *   <li>{@code pulsewatch.alerts.published} / {@code .failed}: alert events delivered or lost</li>
 *   <li>{@code pulsewatch.ingest.latency}: parse and ingest time per message</li>
 *   <li>{@code pulsewatch.core.*}: gauges over the core health snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ServiceMetrics {

    private final MeterRegistry registry;

    private final Counter messagesIngested;
    private final Counter messagesRejected;
    private final Counter alertsPublished;
    private final Counter alertsFailed;
    private final Timer ingestLatency;

    public ServiceMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.messagesIngested = Counter.builder("pulsewatch.messages.ingested")
                .description("Metric messages ingested")
                .register(registry);
        this.messagesRejected = Counter.builder("pulsewatch.messages.rejected")
                .description("Malformed or invalid metric messages skipped")
                .register(registry);
        this.alertsPublished = Counter.builder("pulsewatch.alerts.published")
                .description("Alert events published")
                .register(registry);
        this.alertsFailed = Counter.builder("pulsewatch.alerts.failed")
                .description("Alert events that could not be published")
                .register(registry);
        this.ingestLatency = Timer.builder("pulsewatch.ingest.latency")
                .description("Time to parse and ingest one metric message")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Register gauges that read the core's health snapshot on scrape.
     */
    public void bindTo(AnalyticsCore core) {
        Gauge.builder("pulsewatch.core.tracked_metrics", core, c -> c.health().getTrackedMetrics())
                .description("Live (organization, metric) buffers")
                .register(registry);
        Gauge.builder("pulsewatch.core.buffered_points", core, c -> c.health().getBufferedPoints())
                .description("Points held in live buffers")
                .register(registry);
        Gauge.builder("pulsewatch.core.pending_aggregation_jobs", core,
                        c -> c.health().getPendingAggregationJobs())
                .description("Aggregation jobs not yet done")
                .register(registry);
        Gauge.builder("pulsewatch.core.active_alerts", core, c -> c.health().getActiveAlerts())
                .description("Enabled alert rules")
                .register(registry);
        Gauge.builder("pulsewatch.core.pending_durable_writes", core, c -> c.health().getPendingDurableWrites())
                .description("Points queued for durable storage")
                .register(registry);
    }

    public void messageIngested(Duration latency) {
        messagesIngested.increment();
        ingestLatency.record(latency);
    }

    public void messageRejected() {
        messagesRejected.increment();
    }

    public void alertPublished() {
        alertsPublished.increment();
    }

    public void alertFailed() {
        alertsFailed.increment();
    }

    public double messagesIngested() {
        return messagesIngested.count();
    }

    public double messagesRejected() {
        return messagesRejected.count();
    }

    public double alertsPublished() {
        return alertsPublished.count();
    }

    public double alertsFailed() {
        return alertsFailed.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
