package com.pulsewatch.core.detection;

import com.pulsewatch.core.config.SeverityBands;
import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.AggregatedPoint;
import com.pulsewatch.core.model.Anomaly;
import com.pulsewatch.core.model.AnomalyType;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.DetectionRule;
import com.pulsewatch.core.model.DetectionSource;
import com.pulsewatch.core.model.DetectorParameters;
import com.pulsewatch.core.model.MetricPoint;
import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.storage.MetricQuery;
import com.pulsewatch.core.storage.TimeSeriesStore;
import com.pulsewatch.core.window.RealTimeWindowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Flags unusual values by running detection rules over metric history.
 *
 * <h3>Detection</h3>
 * <p>
 * Each rule names a {@link DetectionMethod}; the {@link DetectorFactory}
 * turns it into an {@link EnsembleVoter}. Every point the voter confirms
 * becomes an {@link Anomaly} whose severity comes from the configured
 * {@link SeverityBands}.
 * </p>
 *
 * <h3>Deduplication</h3>
 * <p>
 * Anomalies are keyed by {@code (organization, metric, timestamp)}. Detecting
 * the same point again returns the stored record instead of creating a new
 * one, and only first-time records reach the {@link AnomalyListener}s.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private static final int TOP_METRICS = 5;

    private final TimeSeriesStore store;
    private final RealTimeWindowEngine windowEngine;
    private final AnomalyRepository repository;
    private final SeverityBands severityBands;
    private final Clock clock;

    private final ConcurrentMap<String, DetectionRule> rules = new ConcurrentHashMap<>();
    private final List<AnomalyListener> listeners = new CopyOnWriteArrayList<>();

    public AnomalyDetectionEngine(TimeSeriesStore store, RealTimeWindowEngine windowEngine,
            AnomalyRepository repository, SeverityBands severityBands, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.windowEngine = Objects.requireNonNull(windowEngine, "windowEngine must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * Register a rule. A blank id is replaced by a generated one.
     *
     * @return the rule id
     * @throws ValidationException if the rule is invalid
     */
    public String addDetectionRule(DetectionRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        rule.validate();
        if (rule.getId() == null || rule.getId().isBlank()) {
            rule.setId("rule_" + rule.getOrganizationId() + "_" + rule.getMetricName() + "_"
                    + UUID.randomUUID().toString().substring(0, 8));
        }
        rules.put(rule.getId(), rule);
        LOG.info("Registered detection rule {} ({} on {}/{}, enabled={})",
                rule.getId(), rule.getMethod(), rule.getOrganizationId(), rule.getMetricName(), rule.isEnabled());
        return rule.getId();
    }

    public boolean removeDetectionRule(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            LOG.info("Removed detection rule {}", ruleId);
        }
        return removed;
    }

    public List<DetectionRule> rules(String organizationId) {
        return rules.values().stream()
                .filter(r -> r.getOrganizationId().equals(organizationId))
                .sorted(Comparator.comparing(DetectionRule::getId))
                .toList();
    }

    public List<DetectionRule> allRules() {
        return List.copyOf(rules.values());
    }

    public void addListener(AnomalyListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Detect anomalies of one metric over the last {@code timeWindowHours}.
     *
     * <p>
     * With a {@code method}, an enabled rule of that method for the metric
     * supplies parameters and source, otherwise defaults apply. Without one,
     * every enabled rule of the metric runs, or a default ensemble if there
     * is none.
     * </p>
     *
     * @return the stored record of every confirmed point, ascending by time
     */
    public List<Anomaly> detect(String metricName, String organizationId, int timeWindowHours,
            DetectionMethod method) {
        if (timeWindowHours < 1) {
            throw new ValidationException("time_window_hours must be >= 1, got: " + timeWindowHours);
        }
        List<DetectionRule> matching = rules.values().stream()
                .filter(DetectionRule::isEnabled)
                .filter(r -> r.getOrganizationId().equals(organizationId) && r.getMetricName().equals(metricName))
                .filter(r -> method == null || r.getMethod() == method)
                .toList();

        List<DetectionRule> toRun = new ArrayList<>();
        if (matching.isEmpty()) {
            toRun.add(adHocRule(metricName, organizationId, method != null ? method : DetectionMethod.ENSEMBLE));
        } else {
            toRun.addAll(matching);
        }

        Map<String, Anomaly> result = new LinkedHashMap<>();
        for (DetectionRule rule : toRun) {
            for (Anomaly a : run(rule, timeWindowHours)) {
                result.putIfAbsent(a.getId(), a);
            }
        }
        return result.values().stream()
                .sorted(Comparator.comparing(Anomaly::getTimestamp))
                .toList();
    }

    /**
     * Run one rule over its own window.
     */
    public List<Anomaly> detect(DetectionRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        return run(rule, rule.getWindowHours());
    }

    /**
     * Run every enabled rule once. A failing rule is logged and does not stop
     * the sweep.
     *
     * @return number of anomalies recorded for the first time
     */
    public int runSweep() {
        long before = repository.count();
        int failures = 0;
        for (DetectionRule rule : rules.values()) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                detect(rule);
            } catch (RuntimeException e) {
                failures++;
                LOG.warn("Detection rule {} on {}/{} failed: {}",
                        rule.getId(), rule.getOrganizationId(), rule.getMetricName(), e.getMessage(), e);
            }
        }
        int recorded = (int) (repository.count() - before);
        LOG.debug("Detection sweep recorded {} new anomaly(ies), {} rule failure(s)", recorded, failures);
        return recorded;
    }

    private List<Anomaly> run(DetectionRule rule, int windowHours) {
        List<Anomaly> found = new ArrayList<>();
        for (MetricSeries series : loadSeries(rule, windowHours)) {
            if (!series.isEmpty()) {
                found.addAll(run(rule, series));
            }
        }
        return found;
    }

    private List<Anomaly> run(DetectionRule rule, MetricSeries series) {
        EnsembleVoter voter = DetectorFactory.forMethod(rule.getMethod(), rule.getParameters());
        EnsembleVoter.Outcome outcome = voter.vote(series);
        if (!outcome.getFailedDetectors().isEmpty()) {
            LOG.warn("Rule {}: detector(s) {} failed on {}, {} still voted",
                    rule.getId(), outcome.getFailedDetectors(), series, outcome.getParticipating());
        }

        Instant now = clock.instant();
        List<Anomaly> found = new ArrayList<>(outcome.getConfirmed().size());
        for (EnsembleVoter.Confirmation c : outcome.getConfirmed()) {
            Anomaly candidate = toAnomaly(series, c, rule.getMethod(), now);
            Anomaly existing = repository.putIfAbsent(candidate);
            if (existing != null) {
                found.add(existing);
                continue;
            }
            found.add(candidate);
            logRecorded(candidate);
            notifyListeners(candidate);
        }
        return found;
    }

    /**
     * Series a rule scores. Raw and live sources give one series; rollups give
     * one per tag group so that groups are never scored against each other.
     */
    private List<MetricSeries> loadSeries(DetectionRule rule, int windowHours) {
        String org = rule.getOrganizationId();
        String metric = rule.getMetricName();
        Instant now = clock.instant();
        Instant start = now.minus(Duration.ofHours(windowHours));
        DetectionSource source = rule.getSource() != null ? rule.getSource() : DetectionSource.HISTORY;
        return switch (source) {
            case HISTORY -> {
                List<MetricPoint> points = store.query(MetricQuery.builder(metric, org)
                        .range(start, now.plusNanos(1))
                        .build());
                yield List.of(MetricSeries.ofPoints(org, metric, points));
            }
            case LIVE_WINDOW -> List.of(MetricSeries.ofPoints(org, metric,
                    windowEngine.windowPoints(metric, org, windowHours * 60)));
            case AGGREGATED -> {
                List<AggregatedPoint> points = store.queryAggregates(metric, org,
                        rule.getAggregationLevel(), start, null);
                yield MetricSeries.ofAggregates(org, metric, points);
            }
        };
    }

    private Anomaly toAnomaly(MetricSeries series, EnsembleVoter.Confirmation c, DetectionMethod method,
            Instant now) {
        Instant timestamp = series.timestamp(c.getIndex());
        double value = series.value(c.getIndex());
        String key = Anomaly.dedupKey(series.getOrganizationId(), series.getMetricName(), series.getTags(),
                timestamp);
        return Anomaly.builder()
                .id("anomaly-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)))
                .timestamp(timestamp)
                .detectedAt(now)
                .metricName(series.getMetricName())
                .organizationId(series.getOrganizationId())
                .tags(series.getTags())
                .value(value)
                .expectedValue(c.getExpectedValue())
                .deviationScore(c.getScore())
                .anomalyType(c.getType())
                .severity(severityBands.classify(c.getScore()))
                .confidence(c.getConfidence())
                .method(method)
                .detectors(c.getDetectors())
                .explanation(explain(series.getMetricName(), value, c, method))
                .build();
    }

    static String explain(String metricName, double value, EnsembleVoter.Confirmation c, DetectionMethod method) {
        double expected = c.getExpectedValue();
        double deviation = expected != 0 ? Math.abs((value - expected) / expected * 100.0) : 0.0;
        String direction = value > expected ? "higher" : "lower";
        return String.format(Locale.ROOT,
                "The %s value of %.2f is %.1f%% %s than expected (%.2f). Detected by %s %s with a deviation score of %.2f.",
                metricName.replace('_', ' '), value, deviation, direction, expected, method, c.getDetectors(),
                c.getScore());
    }

    private void logRecorded(Anomaly anomaly) {
        if (anomaly.getSeverity().isAtLeast(Severity.HIGH)) {
            LOG.warn("{} anomaly on {}/{}: {}", anomaly.getSeverity(), anomaly.getOrganizationId(),
                    anomaly.getMetricName(), anomaly.getExplanation());
        } else {
            LOG.info("{} anomaly on {}/{} at {} (score {})", anomaly.getSeverity(), anomaly.getOrganizationId(),
                    anomaly.getMetricName(), anomaly.getTimestamp(), anomaly.getDeviationScore());
        }
    }

    private void notifyListeners(Anomaly anomaly) {
        for (AnomalyListener listener : listeners) {
            try {
                listener.onAnomaly(anomaly);
            } catch (RuntimeException e) {
                LOG.warn("Anomaly listener failed for {}: {}", anomaly.getId(), e.getMessage(), e);
            }
        }
    }

    private static DetectionRule adHocRule(String metricName, String organizationId, DetectionMethod method) {
        DetectionRule rule = new DetectionRule();
        rule.setId("adhoc_" + organizationId + "_" + metricName + "_" + method);
        rule.setMetricName(metricName);
        rule.setOrganizationId(organizationId);
        rule.setMethod(method);
        rule.setParameters(new DetectorParameters());
        return rule;
    }

    // ---------------------------------------------------------------
    // Records
    // ---------------------------------------------------------------

    /**
     * Mark an anomaly resolved. Resolving a resolved anomaly changes nothing.
     *
     * @return {@code false} if no anomaly has this id
     */
    public boolean resolveAnomaly(String anomalyId, String resolutionNote, String resolvedBy) {
        while (true) {
            Optional<Anomaly> current = repository.findById(anomalyId);
            if (current.isEmpty()) {
                return false;
            }
            Anomaly anomaly = current.get();
            if (anomaly.isResolved()) {
                LOG.debug("Anomaly {} already resolved", anomalyId);
                return true;
            }
            if (repository.replace(anomaly, anomaly.withResolution(resolutionNote, resolvedBy, clock.instant()))) {
                LOG.info("Anomaly {} resolved by {}", anomalyId, resolvedBy);
                return true;
            }
        }
    }

    public Optional<Anomaly> anomaly(String anomalyId) {
        return repository.findById(anomalyId);
    }

    public List<Anomaly> anomalies(String organizationId, Instant since) {
        return repository.findByOrganization(organizationId, since);
    }

    public long recordedAnomalies() {
        return repository.count();
    }

    /**
     * Summarise the anomalies observed in the last {@code hoursBack} hours.
     */
    public AnomalySummary anomalySummary(String organizationId, int hoursBack) {
        if (hoursBack < 1) {
            throw new ValidationException("hours_back must be >= 1, got: " + hoursBack);
        }
        List<Anomaly> recent = repository.findByOrganization(organizationId,
                clock.instant().minus(Duration.ofHours(hoursBack)));

        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        Map<String, Long> byMetric = new TreeMap<>();
        long unresolved = 0;
        for (Anomaly a : recent) {
            bySeverity.merge(a.getSeverity(), 1L, Long::sum);
            byType.merge(a.getAnomalyType(), 1L, Long::sum);
            byMetric.merge(a.getMetricName(), 1L, Long::sum);
            if (!a.isResolved()) {
                unresolved++;
            }
        }
        List<Map.Entry<String, Long>> top = byMetric.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_METRICS)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        return new AnomalySummary(organizationId, hoursBack, recent.size(), bySeverity, byMetric, byType,
                unresolved, recent.size() / (double) hoursBack, top);
    }
}
