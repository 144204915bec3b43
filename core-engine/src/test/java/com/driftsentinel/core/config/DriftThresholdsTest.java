package com.driftsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DriftThresholdsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        DriftThresholds t = DriftThresholds.defaults();

        assertThat(t.getPsiWarning()).isEqualTo(0.1);
        assertThat(t.getPsiCritical()).isEqualTo(0.25);
        assertThat(t.getKlWarning()).isEqualTo(0.1);
        assertThat(t.getKlCritical()).isEqualTo(0.2);
        assertThat(t.getBiasTolerance()).isEqualTo(0.05);
        assertThat(t.getAucDropThreshold()).isEqualTo(0.05);
        assertThat(t.violations()).isEmpty();
    }

    @Test
    @DisplayName("Overrides replace known keys and keep unknown keys as custom")
    void mergeOverrides() {
        DriftThresholds t = DriftThresholds.of(Map.of("psi_critical", 0.4, "drift_budget", 2.0));

        assertThat(t.getPsiCritical()).isEqualTo(0.4);
        assertThat(t.getPsiWarning()).isEqualTo(0.1);
        assertThat(t.getCustom()).containsExactly(Map.entry("drift_budget", 2.0));
        assertThat(t.asMap()).containsEntry("psi_critical", 0.4).containsEntry("drift_budget", 2.0);
    }

    @Test
    @DisplayName("Validation reports every violation at once")
    void validationCollectsAllErrors() {
        DriftThresholds t = DriftThresholds.of(Map.of(
                "psi_warning", 0.3,
                "psi_critical", 0.2,
                "bias_tolerance", -0.1,
                "kl_critical", Double.NaN));

        assertThatThrownBy(t::validate)
                .isInstanceOf(ConfigValidationException.class)
                .satisfies(e -> assertThat(((ConfigValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(msg -> msg.contains("psi_warning"))
                        .anyMatch(msg -> msg.contains("bias_tolerance"))
                        .anyMatch(msg -> msg.contains("finite")));
    }

    @Test
    @DisplayName("Equal warning and critical thresholds are rejected")
    void equalPairIsRejected() {
        assertThat(DriftThresholds.of(Map.of("kl_warning", 0.2)).violations())
                .singleElement()
                .satisfies(msg -> assertThat(msg).contains("kl_warning"));
    }
}
