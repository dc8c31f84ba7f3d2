package com.pulsewatch.core.alert;

import com.pulsewatch.core.model.AlertEvaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertAuditLog}.
 */
class AlertAuditLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should drop the oldest entries beyond capacity")
    void shouldBoundEntries() {
        AlertAuditLog log = new AlertAuditLog(3);
        for (int i = 0; i < 5; i++) {
            log.record(evaluation("a", i));
        }

        assertThat(log.size()).isEqualTo(3);
        assertThat(log.totalRecorded()).isEqualTo(5);
        assertThat(log.recent(10)).extracting(AlertEvaluation::getObservedValue).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    @DisplayName("Should return the newest entries last")
    void shouldLimitRecent() {
        AlertAuditLog log = new AlertAuditLog(10);
        for (int i = 0; i < 4; i++) {
            log.record(evaluation("a", i));
        }

        assertThat(log.recent(2)).extracting(AlertEvaluation::getObservedValue).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Should filter entries by alert")
    void shouldFilterByAlert() {
        AlertAuditLog log = new AlertAuditLog(10);
        log.record(evaluation("a", 1));
        log.record(evaluation("b", 2));
        log.record(evaluation("a", 3));

        assertThat(log.forAlert("a")).extracting(AlertEvaluation::getObservedValue).containsExactly(1.0, 3.0);
        assertThat(log.forAlert("c")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectCapacity() {
        assertThatThrownBy(() -> new AlertAuditLog(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AlertEvaluation evaluation(String alertId, double value) {
        return new AlertEvaluation(alertId, NOW, value, false, false);
    }
}
