package com.driftsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDriftConfigTest {

    @Test
    @DisplayName("A complete registration validates")
    void validRegistration() {
        ModelDriftConfig config = new ModelDriftConfig("credit-risk", "2.1.0", ScheduleInterval.HOURLY);

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.getWindowHours()).isEqualTo(ModelDriftConfig.DEFAULT_WINDOW_HOURS);
        assertThat(config.getFeaturesToMonitor()).isNull();
    }

    @Test
    @DisplayName("CUSTOM without a cron expression is rejected")
    void customRequiresCron() {
        ModelDriftConfig config = new ModelDriftConfig("m", "1", ScheduleInterval.CUSTOM);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("scheduleCron");

        config.setScheduleCron("0 */4 * * *");
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Every missing field and bad threshold is reported")
    void collectsAllErrors() {
        ModelDriftConfig config = new ModelDriftConfig();
        config.setWindowHours(0);
        config.setThresholds(Map.of("psi_warning", 0.9));
        config.setFeaturesToMonitor(Arrays.asList("age", null));

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigValidationException.class)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getErrors())
                        .hasSize(6));
    }

    @Test
    @DisplayName("Numeric baseline and threshold values are normalized to double")
    void normalizesNumbers() {
        ModelDriftConfig config = new ModelDriftConfig("m", "1", ScheduleInterval.DAILY);
        config.setBaselineData(Map.of("age", List.of(21, 34L, 45.5)));
        config.setThresholds(Map.of("psi_critical", 1));

        assertThat(config.getBaselineData().get("age")).containsExactly(21.0, 34.0, 45.5);
        assertThat(config.getThresholds()).containsEntry("psi_critical", 1.0);
        assertThat(config.resolvedThresholds().getPsiCritical()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Non-numeric samples are rejected")
    void rejectsNonNumericSamples() {
        ModelDriftConfig config = new ModelDriftConfig("m", "1", ScheduleInterval.DAILY);

        assertThatThrownBy(() -> config.setBaselineData(Map.of("age", List.of("young"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("age");
    }

    @Test
    @DisplayName("copy() is independent of the original")
    void copyIsIndependent() {
        ModelDriftConfig original = new ModelDriftConfig("m", "1", ScheduleInterval.WEEKLY);
        original.setFeaturesToMonitor(List.of("age"));
        original.setAlertCallback((id, details) -> { });

        ModelDriftConfig copy = original.copy();
        original.setEnabled(false);
        original.setFeaturesToMonitor(List.of("income"));

        assertThat(copy.isEnabled()).isTrue();
        assertThat(copy.getFeaturesToMonitor()).containsExactly("age");
        assertThat(copy.getAlertCallback()).isSameAs(original.getAlertCallback());
        assertThat(copy).isEqualTo(original);
    }
}
