package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Safety incident raised against a deployed model.
 *
 * <p>
 * Events are created in the {@value #STATUS_OPEN} state. Acknowledging or
 * resolving them is the job of the downstream ticketing integration; this
 * class is immutable.
 * </p>
 *
 * <p>
 * {@code autoPaused} is derived from the severity: it is {@code true} exactly
 * when the severity is {@link SafetySeverity#CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SafetyEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String STATUS_OPEN = "OPEN";

    private final UUID eventId;
    private final String modelId;
    private final String eventType;
    private final SafetySeverity severity;
    private final String description;
    private final Map<String, Object> details;
    private final boolean autoPaused;
    private final String resolutionStatus;
    private final Instant createdAt;

    private SafetyEvent(Builder b) {
        this.eventId = b.eventId != null ? b.eventId : UUID.randomUUID();
        this.modelId = Objects.requireNonNull(b.modelId, "modelId must not be null");
        this.eventType = Objects.requireNonNull(b.eventType, "eventType must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.description = b.description;
        this.details = b.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.details))
                : Collections.emptyMap();
        this.autoPaused = severity == SafetySeverity.CRITICAL;
        this.resolutionStatus = STATUS_OPEN;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SafetyEvent}.
     *
     * <p>
     * {@code eventId} defaults to a random UUID. {@code modelId},
     * {@code eventType}, {@code severity} and {@code createdAt} are required.
     * </p>
     */
    public static class Builder {
        private UUID eventId;
        private String modelId;
        private String eventType;
        private SafetySeverity severity;
        private String description;
        private Map<String, Object> details;
        private Instant createdAt;

        public Builder eventId(UUID eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder severity(SafetySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SafetyEvent build() {
            return new SafetyEvent(this);
        }
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getEventType() {
        return eventType;
    }

    public SafetySeverity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable event details
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isAutoPaused() {
        return autoPaused;
    }

    public String getResolutionStatus() {
        return resolutionStatus;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SafetyEvent that))
            return false;
        return eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "SafetyEvent{" +
                "eventId=" + eventId +
                ", modelId='" + modelId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", severity=" + severity +
                ", autoPaused=" + autoPaused +
                ", description='" + description + '\'' +
                '}';
    }
}
