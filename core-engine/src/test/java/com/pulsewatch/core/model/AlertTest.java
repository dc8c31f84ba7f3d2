package com.pulsewatch.core.model;

import com.pulsewatch.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Alert} validation and {@link ThresholdType}.
 */
class AlertTest {

    @Test
    @DisplayName("Should accept a complete alert")
    void shouldAcceptValidAlert() {
        Alert alert = new Alert("cpu_usage", "org-a", ThresholdType.ABOVE, 90, Severity.HIGH, 5);

        alert.validate();

        assertThat(alert.getStatistic()).isEqualTo(AlertStatistic.AVG);
        assertThat(alert.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should list every problem of an invalid alert")
    void shouldCollectAllErrors() {
        Alert alert = new Alert();
        alert.setWindowMinutes(0);

        assertThatThrownBy(alert::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("metricName")
                .hasMessageContaining("organizationId")
                .hasMessageContaining("windowMinutes");
    }

    @Test
    @DisplayName("Should compare thresholds strictly")
    void shouldCompareStrictly() {
        assertThat(ThresholdType.ABOVE.isBreached(90.1, 90)).isTrue();
        assertThat(ThresholdType.ABOVE.isBreached(90, 90)).isFalse();
        assertThat(ThresholdType.BELOW.isBreached(9.9, 10)).isTrue();
        assertThat(ThresholdType.BELOW.isBreached(10, 10)).isFalse();
    }
}
