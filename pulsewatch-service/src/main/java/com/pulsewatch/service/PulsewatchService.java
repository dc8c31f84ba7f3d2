package com.pulsewatch.service;

import com.pulsewatch.core.AnalyticsCore;
import com.pulsewatch.core.config.RulesConfig;
import com.pulsewatch.core.config.RulesLoader;
import com.pulsewatch.core.storage.InMemoryTimeSeriesStore;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Pulsewatch service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (metrics topic)
 *     → MetricMessageParser → AnalyticsCore.ingest
 *     → live windows + durable store → rollups, detection sweeps, alert ticks
 *     → AlertEvent → KafkaAlertPublisher
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via {@link ServiceConfig};
 * engine settings, rules and alerts come from the YAML loaded by
 * {@link RulesLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PulsewatchService {

    private static final Logger LOG = LoggerFactory.getLogger(PulsewatchService.class);

    private PulsewatchService() {
        // entry point only
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Pulsewatch with config: {}", config);

        // 2. Load rules and engine settings
        RulesConfig rules = RulesLoader.load(config.getRulesConfigPath());
        LOG.info("Loaded {} rule(s)", rules.totalRules());

        // 3. Build the core
        AnalyticsCore core = new AnalyticsCore(rules.getEngine(), new InMemoryTimeSeriesStore(), Clock.systemUTC());
        core.applyRules(rules);

        // 4. Metrics, health, alert publication
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        ServiceMetrics metrics = new ServiceMetrics(registry);
        metrics.bindTo(core);

        KafkaAlertPublisher publisher = new KafkaAlertPublisher(
                new KafkaProducer<>(config.kafkaProducerProperties()),
                config.getKafkaAlertsTopic(), new AlertEventSerializer(), metrics);
        core.addAlertListener(publisher);

        HealthServer healthServer = new HealthServer(core, registry);
        healthServer.start(config.getHealthPort());

        core.start();

        // 5. Ingestion
        MetricIngestConsumer consumer = null;
        Thread consumerThread = null;
        if (config.isKafkaIngestEnabled()) {
            consumer = new MetricIngestConsumer(new KafkaConsumer<>(config.kafkaConsumerProperties()),
                    config.getKafkaMetricsTopic(), core, new MetricMessageParser(), metrics);
            consumerThread = new Thread(consumer, "metric-consumer");
            consumerThread.start();
        } else {
            LOG.info("Kafka ingestion disabled");
        }

        // 6. Ordered shutdown
        CountDownLatch stopped = new CountDownLatch(1);
        MetricIngestConsumer finalConsumer = consumer;
        Thread finalConsumerThread = consumerThread;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown signal received");
            if (finalConsumer != null) {
                finalConsumer.shutdown();
                joinQuietly(finalConsumerThread);
            }
            core.close();
            publisher.close();
            healthServer.stop();
            registry.close();
            stopped.countDown();
        }, "pulsewatch-shutdown"));

        stopped.await();
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(30_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the metric consumer to stop");
        }
    }
}
