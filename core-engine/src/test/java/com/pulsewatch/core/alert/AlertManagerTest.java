package com.pulsewatch.core.alert;

import com.pulsewatch.core.MutableClock;
import com.pulsewatch.core.error.ValidationException;
import com.pulsewatch.core.model.Alert;
import com.pulsewatch.core.model.AlertEvaluation;
import com.pulsewatch.core.model.AlertEvent;
import com.pulsewatch.core.model.AlertEventSource;
import com.pulsewatch.core.model.AlertStatistic;
import com.pulsewatch.core.model.Anomaly;
import com.pulsewatch.core.model.AnomalyType;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.model.ThresholdType;
import com.pulsewatch.core.window.RealTimeWindowEngine;
import com.pulsewatch.core.window.WindowStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String ORG = "org-a";

    private MutableClock clock;
    private RealTimeWindowEngine windowEngine;
    private AlertManager manager;
    private final List<AlertEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        windowEngine = new RealTimeWindowEngine(1000, null, clock);
        manager = new AlertManager(windowEngine, 100, Duration.ofSeconds(60), Severity.HIGH, clock);
        manager.addListener(events::add);
    }

    @Test
    @DisplayName("Should fire once while the condition holds and again after it clears")
    void shouldFireOnTransitionOnly() {
        String id = manager.configureAlert(cpuAbove(90));

        ingest(95);
        assertThat(manager.evaluate(id).isFired()).isTrue();
        assertThat(manager.evaluate(id).isFired()).isFalse();
        assertThat(events).hasSize(1);

        clock.advance(Duration.ofMinutes(6));
        ingest(50);
        AlertEvaluation cleared = manager.evaluate(id);
        assertThat(cleared.isBreached()).isFalse();

        ingest(200);
        assertThat(manager.evaluate(id).isFired()).isTrue();
        assertThat(events).hasSize(2);
        assertThat(manager.firedTotal()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should describe the breach in the emitted event")
    void shouldBuildThresholdEvent() {
        String id = manager.configureAlert(cpuAbove(90));
        ingest(92);
        ingest(98);

        manager.evaluate(id);

        AlertEvent event = events.get(0);
        assertThat(event.getSource()).isEqualTo(AlertEventSource.THRESHOLD);
        assertThat(event.getAlertId()).isEqualTo(id);
        assertThat(event.getObservedValue()).isEqualTo(95.0);
        assertThat(event.getThreshold()).isEqualTo(90.0);
        assertThat(event.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getMessage()).isEqualTo("avg(cpu_usage) over 5m = 95.00, above threshold 90.00");
        assertThat(manager.alert(id).orElseThrow().getTriggeredAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should record every evaluation in the audit log")
    void shouldAuditEveryEvaluation() {
        String id = manager.configureAlert(cpuAbove(90));
        ingest(95);

        manager.evaluate(id);
        manager.evaluate(id);
        manager.evaluate(id);

        List<AlertEvaluation> audit = manager.auditLog().forAlert(id);
        assertThat(audit).hasSize(3);
        assertThat(audit).extracting(AlertEvaluation::isFired).containsExactly(true, false, false);
        assertThat(audit).allMatch(AlertEvaluation::isBreached);
    }

    @Test
    @DisplayName("Should never breach on an empty window for value statistics")
    void shouldNotBreachOnEmptyWindow() {
        Alert alert = new Alert("cpu_usage", ORG, ThresholdType.BELOW, 10, Severity.LOW, 5);
        String id = manager.configureAlert(alert);

        AlertEvaluation evaluation = manager.evaluate(id);

        assertThat(evaluation.isBreached()).isFalse();
        assertThat(evaluation.getObservedValue()).isNaN();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Should breach a low-throughput alert on an empty window")
    void shouldBreachRateOnEmptyWindow() {
        Alert alert = new Alert("requests", ORG, ThresholdType.BELOW, 10, Severity.MEDIUM, 5);
        alert.setStatistic(AlertStatistic.RATE_PER_MINUTE);
        String id = manager.configureAlert(alert);

        assertThat(manager.evaluate(id).isFired()).isTrue();
        assertThat(events.get(0).getObservedValue()).isZero();
    }

    @Test
    @DisplayName("Should evaluate due alerts only on tick")
    void shouldRespectPeriodOnTick() {
        String id = manager.configureAlert(cpuAbove(90));
        assertThat(manager.periodOf(id)).isEqualTo(Duration.ofMinutes(1));

        assertThat(manager.tick()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(30));
        assertThat(manager.tick()).isZero();
        clock.advance(Duration.ofSeconds(30));
        assertThat(manager.tick()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should use a fifth of a short window as the period")
    void shouldDerivePeriodFromWindow() {
        Alert alert = cpuAbove(90);
        alert.setWindowMinutes(1);

        String id = manager.configureAlert(alert);

        assertThat(manager.periodOf(id)).isEqualTo(Duration.ofSeconds(12));
        assertThat(manager.shortestPeriod()).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    @DisplayName("Should skip disabled alerts")
    void shouldSkipDisabledAlerts() {
        Alert alert = cpuAbove(90);
        alert.setEnabled(false);
        manager.configureAlert(alert);
        ingest(99);

        assertThat(manager.tick()).isZero();
        assertThat(manager.evaluateAll()).isZero();
        assertThat(manager.activeAlertCount()).isZero();
    }

    @Test
    @DisplayName("Should keep publishing when a listener throws")
    void shouldIsolateListenerFailures() {
        manager.addListener(e -> {
            throw new IllegalStateException("sink down");
        });
        List<AlertEvent> after = new ArrayList<>();
        manager.addListener(after::add);
        String id = manager.configureAlert(cpuAbove(90));
        ingest(99);

        manager.evaluate(id);

        assertThat(events).hasSize(1);
        assertThat(after).hasSize(1);
    }

    @Test
    @DisplayName("Should turn severe anomalies into alert events")
    void shouldForwardSevereAnomalies() {
        manager.onAnomaly(anomaly(Severity.MEDIUM));
        manager.onAnomaly(anomaly(Severity.CRITICAL));

        assertThat(events).hasSize(1);
        AlertEvent event = events.get(0);
        assertThat(event.getSource()).isEqualTo(AlertEventSource.ANOMALY);
        assertThat(event.getAlertId()).isEqualTo("anomaly-CRITICAL");
        assertThat(event.getThreshold()).isEqualTo(100.0);
        assertThat(event.getMessage()).isEqualTo("spike");
    }

    @Test
    @DisplayName("Should generate an id and reject invalid alerts")
    void shouldValidateOnConfigure() {
        String id = manager.configureAlert(cpuAbove(90));
        assertThat(id).startsWith("alert_org-a_cpu_usage_");
        assertThat(manager.alerts(ORG)).hasSize(1);

        Alert invalid = cpuAbove(90);
        invalid.setWindowMinutes(0);
        assertThatThrownBy(() -> manager.configureAlert(invalid)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> manager.evaluate("missing")).isInstanceOf(ValidationException.class);

        assertThat(manager.removeAlert(id)).isTrue();
        assertThat(manager.alerts(ORG)).isEmpty();
    }

    @Test
    @DisplayName("Should observe NaN only for statistics undefined on an empty window")
    void shouldObserveEmptyWindow() {
        WindowStats empty = WindowStats.empty(5);

        assertThat(AlertManager.observe(AlertStatistic.MAX, empty)).isNaN();
        assertThat(AlertManager.observe(AlertStatistic.P99, empty)).isNaN();
        assertThat(AlertManager.observe(AlertStatistic.COUNT, empty)).isZero();
        assertThat(AlertManager.observe(AlertStatistic.SUM, empty)).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ingest(double value) {
        windowEngine.ingest("cpu_usage", value, ORG, null, null);
    }

    private static Alert cpuAbove(double threshold) {
        return new Alert("cpu_usage", ORG, ThresholdType.ABOVE, threshold, Severity.HIGH, 5);
    }

    private static Anomaly anomaly(Severity severity) {
        return Anomaly.builder()
                .id("anomaly-" + severity)
                .timestamp(NOW)
                .detectedAt(NOW)
                .metricName("cpu_usage")
                .organizationId(ORG)
                .value(500)
                .expectedValue(100)
                .deviationScore(7)
                .anomalyType(AnomalyType.POINT)
                .severity(severity)
                .confidence(1)
                .method(DetectionMethod.STATISTICAL)
                .explanation("spike")
                .build();
    }
}
