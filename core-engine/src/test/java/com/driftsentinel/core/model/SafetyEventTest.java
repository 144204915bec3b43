package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafetyEventTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Test
    @DisplayName("Only CRITICAL events auto-pause the model")
    void onlyCriticalAutoPauses() {
        for (SafetySeverity severity : SafetySeverity.values()) {
            SafetyEvent event = event(severity);
            assertThat(event.isAutoPaused())
                    .as("autoPaused for %s", severity)
                    .isEqualTo(severity == SafetySeverity.CRITICAL);
        }
    }

    @Test
    @DisplayName("New events are OPEN and get a unique id")
    void newEventsAreOpen() {
        SafetyEvent a = event(SafetySeverity.INFO);
        SafetyEvent b = event(SafetySeverity.INFO);

        assertThat(a.getResolutionStatus()).isEqualTo(SafetyEvent.STATUS_OPEN);
        assertThat(a.getEventId()).isNotNull().isNotEqualTo(b.getEventId());
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    @DisplayName("Details are copied and read-only")
    void detailsAreImmutable() {
        Map<String, Object> details = new HashMap<>();
        details.put("k", 1);
        SafetyEvent event = SafetyEvent.builder()
                .modelId("m")
                .eventType("DRIFT_ALERT")
                .severity(SafetySeverity.WARNING)
                .description("d")
                .details(details)
                .createdAt(NOW)
                .build();
        details.put("other", 2);

        assertThat(event.getDetails()).containsOnlyKeys("k");
        assertThatThrownBy(() -> event.getDetails().put("x", 3))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Only ERROR and CRITICAL require notification")
    void notificationSeverities() {
        assertThat(SafetySeverity.INFO.requiresNotification()).isFalse();
        assertThat(SafetySeverity.WARNING.requiresNotification()).isFalse();
        assertThat(SafetySeverity.ERROR.requiresNotification()).isTrue();
        assertThat(SafetySeverity.CRITICAL.requiresNotification()).isTrue();
    }

    // ---- Helpers ----

    private static SafetyEvent event(SafetySeverity severity) {
        return SafetyEvent.builder()
                .modelId("credit-risk")
                .eventType("TEST")
                .severity(severity)
                .description("test event")
                .createdAt(NOW)
                .build();
    }
}
