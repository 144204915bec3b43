package com.driftsentinel.scheduler.app;

import com.driftsentinel.core.model.AlertLevel;
import com.driftsentinel.core.model.SafetyEvent;
import com.driftsentinel.core.model.SafetySeverity;
import com.driftsentinel.scheduler.DriftCheckResult;
import com.driftsentinel.scheduler.ExecutionStatus;
import com.driftsentinel.scheduler.SchedulerStatistics;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSupportTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Test
    @DisplayName("Check results use snake_case, ISO timestamps and omit nulls")
    void checkResultJson() throws Exception {
        DriftCheckResult result = DriftCheckResult.builder()
                .checkId("c-1")
                .modelId("credit-risk")
                .modelVersion("2.1.0")
                .timestamp(NOW)
                .status(ExecutionStatus.COMPLETED)
                .durationMs(12.5)
                .alertGenerated(true)
                .alertLevel(AlertLevel.WARNING)
                .metrics(Map.of(DriftCheckResult.METRIC_OVERALL_STATUS, "WARNING"))
                .build();

        JsonNode json = JsonSupport.mapper().readTree(JsonSupport.toJson(result));

        assertThat(json.get("check_id").asText()).isEqualTo("c-1");
        assertThat(json.get("model_id").asText()).isEqualTo("credit-risk");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-04T10:00:00Z");
        assertThat(json.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(json.get("duration_ms").asDouble()).isEqualTo(12.5);
        assertThat(json.get("alert_generated").asBoolean()).isTrue();
        assertThat(json.get("alert_level").asText()).isEqualTo("WARNING");
        assertThat(json.get("metrics").get("overall_status").asText()).isEqualTo("WARNING");
        assertThat(json.has("error_message")).isFalse();
        assertThat(json.has("report")).isFalse();
    }

    @Test
    @DisplayName("Safety events export their flags and details")
    void safetyEventJson() throws Exception {
        SafetyEvent event = SafetyEvent.builder()
                .modelId("credit-risk")
                .eventType("DRIFT_ALERT")
                .severity(SafetySeverity.CRITICAL)
                .description("Critical drift detected in age")
                .details(Map.of("metric_name", "PSI"))
                .createdAt(NOW)
                .build();

        JsonNode json = JsonSupport.mapper().readTree(JsonSupport.toJsonBytes(event));

        assertThat(json.get("event_id").asText()).isEqualTo(event.getEventId().toString());
        assertThat(json.get("auto_paused").asBoolean()).isTrue();
        assertThat(json.get("resolution_status").asText()).isEqualTo("OPEN");
        assertThat(json.get("created_at").asText()).isEqualTo("2024-03-04T10:00:00Z");
        assertThat(json.get("details").get("metric_name").asText()).isEqualTo("PSI");
    }

    @Test
    @DisplayName("Statistics include the success rate")
    void statisticsJson() throws Exception {
        JsonNode json = JsonSupport.mapper().readTree(
                JsonSupport.toJson(new SchedulerStatistics(2, 2, 4, 3, 1, 0, 1)));

        assertThat(json.get("total_executions").asInt()).isEqualTo(4);
        assertThat(json.get("failed_executions").asInt()).isEqualTo(1);
        assertThat(json.get("success_rate").asDouble()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("A value that cannot be serialized yields an empty payload")
    void failureYieldsEmptyPayload() {
        assertThat(JsonSupport.toJson(new Object())).isEmpty();
        assertThat(JsonSupport.toJsonBytes(new Object())).isEmpty();
    }
}
