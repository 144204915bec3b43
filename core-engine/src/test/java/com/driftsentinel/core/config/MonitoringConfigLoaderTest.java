package com.driftsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitoringConfigLoaderTest {

    @Test
    @DisplayName("Should load models from a classpath YAML file")
    void shouldLoadFromClasspath() {
        MonitoringConfig config = MonitoringConfigLoader.fromClasspath("test-models.yml");

        assertThat(config.getModels()).hasSize(2);

        ModelDriftConfig credit = config.getModels().get(0);
        assertThat(credit.getModelId()).isEqualTo("credit-risk");
        assertThat(credit.getModelVersion()).isEqualTo("2.1.0");
        assertThat(credit.getScheduleInterval()).isEqualTo(ScheduleInterval.HOURLY);
        assertThat(credit.getFeaturesToMonitor()).containsExactly("age", "income");
        assertThat(credit.getBaselineData().get("age")).containsExactly(21.0, 34.0, 45.0, 52.0);
        assertThat(credit.getThresholds()).containsEntry("psi_critical", 0.3);
        assertThat(credit.resolvedThresholds().getCustom()).containsEntry("drift_budget", 2.0);
        assertThat(credit.isEnabled()).isTrue();

        ModelDriftConfig fraud = config.getModels().get(1);
        assertThat(fraud.getScheduleInterval()).isEqualTo(ScheduleInterval.CUSTOM);
        assertThat(fraud.getScheduleCron()).isEqualTo("0 */4 * * *");
        assertThat(fraud.isEnabled()).isFalse();
        assertThat(fraud.getWindowHours()).isEqualTo(6);
        assertThat(fraud.getBaselineData()).isEmpty();
    }

    @Test
    @DisplayName("Should throw for a missing classpath resource")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> MonitoringConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("absent.yml").toString();
        assertThatThrownBy(() -> MonitoringConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(path);
    }

    @Test
    @DisplayName("Should load models from a file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("models.yml");
        Files.writeString(file, String.join("\n",
                "models:",
                "  - modelId: churn",
                "    modelVersion: \"1.0\"",
                "    scheduleInterval: weekly"));

        MonitoringConfig config = MonitoringConfigLoader.fromFile(file.toString());

        assertThat(config.getModels()).singleElement()
                .satisfies(m -> assertThat(m.getScheduleInterval()).isEqualTo(ScheduleInterval.WEEKLY));
    }

    @Test
    @DisplayName("Should report every invalid field of an invalid model")
    void shouldRejectInvalidModel() {
        assertThatThrownBy(() -> MonitoringConfigLoader.fromClasspath("invalid-models.yml"))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("scheduleCron")
                .hasMessageContaining("psi_warning");
    }

    @Test
    @DisplayName("Should reject duplicate model ids")
    void shouldRejectDuplicateModelIds() {
        assertThatThrownBy(() -> MonitoringConfigLoader.fromClasspath("duplicate-models.yml"))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("Duplicate modelId 'same'");
    }

    @Test
    @DisplayName("Should treat an empty document as an empty registry")
    void shouldAcceptEmptyDocument() {
        MonitoringConfig config = MonitoringConfigLoader.parseAndValidate(
                new ByteArrayInputStream("".getBytes(StandardCharsets.UTF_8)));
        assertThat(config.getModels()).isEmpty();
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        String yaml = String.join("\n",
                "models:",
                "  - modelId: a",
                "    modelId: b",
                "    modelVersion: \"1\"",
                "    scheduleInterval: DAILY");
        assertThatThrownBy(() -> MonitoringConfigLoader.parseAndValidate(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .hasMessageContaining("duplicate");
    }
}
