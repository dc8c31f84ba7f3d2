package com.pulsewatch.core.alert;

import com.pulsewatch.core.detection.AnomalyListener;
import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.Alert;
import com.pulsewatch.core.model.AlertEvaluation;
import com.pulsewatch.core.model.AlertEvent;
import com.pulsewatch.core.model.AlertEventSource;
import com.pulsewatch.core.model.AlertStatistic;
import com.pulsewatch.core.model.Anomaly;
import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.window.RealTimeWindowEngine;
import com.pulsewatch.core.window.WindowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates threshold alerts against live window statistics.
 *
 * <h3>Firing</h3>
 * <p>
 * An alert fires once when its condition turns true. While the condition
 * stays true later evaluations are recorded but emit nothing; the condition
 * must clear before the alert can fire again. Every evaluation goes to the
 * {@link AlertAuditLog}.
 * </p>
 *
 * <h3>Scheduling</h3>
 * <p>
 * {@link #tick()} evaluates each enabled alert whose period has elapsed. The
 * period is {@code min(maxTick, windowMinutes / 5)}.
 * </p>
 *
 * <h3>Anomalies</h3>
 * <p>
 * As an {@link AnomalyListener}, the manager turns anomalies at or above a
 * minimum severity into {@link AlertEventSource#ANOMALY} events.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager implements AnomalyListener {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    private final RealTimeWindowEngine windowEngine;
    private final AlertAuditLog auditLog;
    private final Duration maxTick;
    private final Severity anomalyMinSeverity;
    private final Clock clock;

    private final ConcurrentMap<String, AlertState> states = new ConcurrentHashMap<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong fired = new AtomicLong();

    public AlertManager(RealTimeWindowEngine windowEngine, int auditCapacity, Duration maxTick,
            Severity anomalyMinSeverity, Clock clock) {
        this.windowEngine = Objects.requireNonNull(windowEngine, "windowEngine must not be null");
        this.auditLog = new AlertAuditLog(auditCapacity);
        this.maxTick = Objects.requireNonNull(maxTick, "maxTick must not be null");
        this.anomalyMinSeverity = Objects.requireNonNull(anomalyMinSeverity, "anomalyMinSeverity must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxTick.isNegative() || maxTick.isZero()) {
            throw new IllegalArgumentException("maxTick must be positive, got: " + maxTick);
        }
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Register or replace an alert. A blank id is replaced by a generated one.
     *
     * @return the alert id
     * @throws ValidationException if the alert is invalid
     */
    public String configureAlert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        alert.validate();
        if (alert.getId() == null || alert.getId().isBlank()) {
            alert.setId("alert_" + alert.getOrganizationId() + "_" + alert.getMetricName() + "_"
                    + UUID.randomUUID().toString().substring(0, 8));
        }
        states.put(alert.getId(), new AlertState(alert, periodOf(alert)));
        LOG.info("Configured alert {}: {}({}) {} {} over {}m, severity {}",
                alert.getId(), alert.getStatistic(), alert.getMetricName(), alert.getThresholdType(),
                alert.getThresholdValue(), alert.getWindowMinutes(), alert.getSeverity());
        return alert.getId();
    }

    public boolean removeAlert(String alertId) {
        boolean removed = states.remove(alertId) != null;
        if (removed) {
            LOG.info("Removed alert {}", alertId);
        }
        return removed;
    }

    public Optional<Alert> alert(String alertId) {
        AlertState state = states.get(alertId);
        return state == null ? Optional.empty() : Optional.of(state.alert);
    }

    public List<Alert> alerts(String organizationId) {
        return states.values().stream()
                .map(s -> s.alert)
                .filter(a -> a.getOrganizationId().equals(organizationId))
                .sorted(Comparator.comparing(Alert::getId))
                .toList();
    }

    /**
     * Number of enabled alerts.
     */
    public int activeAlertCount() {
        return (int) states.values().stream().filter(s -> s.alert.isEnabled()).count();
    }

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean removeListener(AlertListener listener) {
        return listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate every enabled alert that is due.
     *
     * @return number of alerts evaluated
     */
    public int tick() {
        Instant now = clock.instant();
        int evaluated = 0;
        for (AlertState state : states.values()) {
            if (!state.alert.isEnabled() || now.isBefore(state.nextDueAt)) {
                continue;
            }
            try {
                evaluate(state, now);
                evaluated++;
            } catch (RuntimeException e) {
                LOG.warn("Evaluation of alert {} failed: {}", state.alert.getId(), e.getMessage(), e);
            }
        }
        return evaluated;
    }

    /**
     * Evaluate every enabled alert now, regardless of its period.
     */
    public int evaluateAll() {
        Instant now = clock.instant();
        int evaluated = 0;
        for (AlertState state : states.values()) {
            if (state.alert.isEnabled()) {
                evaluate(state, now);
                evaluated++;
            }
        }
        return evaluated;
    }

    /**
     * Evaluate one alert now.
     *
     * @throws ValidationException if no alert has this id
     */
    public AlertEvaluation evaluate(String alertId) {
        AlertState state = states.get(alertId);
        if (state == null) {
            throw new ValidationException("Unknown alert: " + alertId);
        }
        return evaluate(state, clock.instant());
    }

    private AlertEvaluation evaluate(AlertState state, Instant now) {
        Alert alert = state.alert;
        WindowStats stats = windowEngine.windowStats(alert.getMetricName(), alert.getOrganizationId(),
                alert.getWindowMinutes());
        double observed = observe(alert.getStatistic(), stats);
        boolean breached = !Double.isNaN(observed)
                && alert.getThresholdType().isBreached(observed, alert.getThresholdValue());

        boolean fire;
        synchronized (state) {
            fire = breached && !state.breached;
            state.breached = breached;
            state.nextDueAt = now.plus(state.period);
        }

        AlertEvaluation evaluation = new AlertEvaluation(alert.getId(), now, observed, breached, fire);
        auditLog.record(evaluation);
        if (fire) {
            alert.setTriggeredAt(now);
            fired.incrementAndGet();
            AlertEvent event = AlertEvent.builder()
                    .alertId(alert.getId())
                    .source(AlertEventSource.THRESHOLD)
                    .organizationId(alert.getOrganizationId())
                    .metricName(alert.getMetricName())
                    .observedValue(observed)
                    .threshold(alert.getThresholdValue())
                    .severity(alert.getSeverity())
                    .timestamp(now)
                    .message(String.format(Locale.ROOT, "%s(%s) over %dm = %.2f, %s threshold %.2f",
                            alert.getStatistic().name().toLowerCase(Locale.ROOT), alert.getMetricName(),
                            alert.getWindowMinutes(), observed,
                            alert.getThresholdType().name().toLowerCase(Locale.ROOT), alert.getThresholdValue()))
                    .build();
            LOG.warn("Alert {} fired [{}] for {}/{}: {}", alert.getId(), alert.getSeverity(),
                    alert.getOrganizationId(), alert.getMetricName(), event.getMessage());
            publish(event);
        } else if (breached) {
            LOG.debug("Alert {} still breached ({}), not re-firing", alert.getId(), observed);
        }
        return evaluation;
    }

    /**
     * Value of {@code statistic} in {@code stats}; {@code NaN} when the
     * statistic is undefined over an empty window.
     */
    static double observe(AlertStatistic statistic, WindowStats stats) {
        if (stats.isEmpty() && !statistic.isDefinedWhenEmpty()) {
            return Double.NaN;
        }
        return switch (statistic) {
            case AVG -> stats.getAvg();
            case LAST -> stats.getLastValue();
            case MIN -> stats.getMin();
            case MAX -> stats.getMax();
            case SUM -> stats.getSum();
            case COUNT -> stats.getCount();
            case RATE_PER_MINUTE -> stats.getRatePerMinute();
            case P95 -> stats.getP95();
            case P99 -> stats.getP99();
        };
    }

    // ---------------------------------------------------------------
    // Anomalies
    // ---------------------------------------------------------------

    @Override
    public void onAnomaly(Anomaly anomaly) {
        if (!anomaly.getSeverity().isAtLeast(anomalyMinSeverity)) {
            return;
        }
        fired.incrementAndGet();
        publish(AlertEvent.builder()
                .alertId(anomaly.getId())
                .source(AlertEventSource.ANOMALY)
                .organizationId(anomaly.getOrganizationId())
                .metricName(anomaly.getMetricName())
                .observedValue(anomaly.getValue())
                .threshold(anomaly.getExpectedValue())
                .severity(anomaly.getSeverity())
                .timestamp(anomaly.getTimestamp())
                .message(anomaly.getExplanation())
                .build());
    }

    private void publish(AlertEvent event) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(event);
            } catch (RuntimeException e) {
                LOG.warn("Alert listener failed for {}: {}", event.getAlertId(), e.getMessage(), e);
            }
        }
    }

    private Duration periodOf(Alert alert) {
        Duration fifth = Duration.ofSeconds(Math.max(1, alert.getWindowMinutes() * 60L / 5));
        return fifth.compareTo(maxTick) < 0 ? fifth : maxTick;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AlertAuditLog auditLog() {
        return auditLog;
    }

    public long firedTotal() {
        return fired.get();
    }

    /**
     * Smallest evaluation period across alerts, used to size the scheduler tick.
     */
    public Duration shortestPeriod() {
        return states.values().stream()
                .map(s -> s.period)
                .min(Comparator.naturalOrder())
                .orElse(maxTick);
    }

    public Duration periodOf(String alertId) {
        AlertState state = states.get(alertId);
        if (state == null) {
            throw new ValidationException("Unknown alert: " + alertId);
        }
        return state.period;
    }

    private static final class AlertState {
        private final Alert alert;
        private final Duration period;
        private boolean breached;
        private Instant nextDueAt = Instant.MIN;

        private AlertState(Alert alert, Duration period) {
            this.alert = alert;
            this.period = period;
        }
    }
}
