package com.driftsentinel.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerConfigTest {

    @Test
    @DisplayName("Defaults are applied when nothing is set")
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertThat(config.getHistoryCapacity()).isEqualTo(1000);
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getScheduleZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(config.getModelsConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Builder rejects out-of-range values")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> SchedulerConfig.builder().historyCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historyCapacity");
        assertThatThrownBy(() -> SchedulerConfig.builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> SchedulerConfig.builder().scheduleZone(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Builder values are kept")
    void builderValues() {
        SchedulerConfig config = SchedulerConfig.builder()
                .historyCapacity(50)
                .workerThreads(2)
                .scheduleZone(ZoneId.of("Europe/Berlin"))
                .modelsConfigPath("/etc/drift/models.yml")
                .build();

        assertThat(config.getHistoryCapacity()).isEqualTo(50);
        assertThat(config.getWorkerThreads()).isEqualTo(2);
        assertThat(config.getScheduleZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.getModelsConfigPath()).isEqualTo("/etc/drift/models.yml");
    }
}
