package com.driftsentinel.scheduler;

import com.driftsentinel.core.model.AlertLevel;
import com.driftsentinel.core.model.DriftReport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of one drift check, as kept in the execution history.
 *
 * <p>
 * Only terminal states are representable. {@link #getMetrics()} carries the
 * summary counts of the underlying report:
 * {@value #METRIC_INPUT_DRIFT_COUNT}, {@value #METRIC_OUTPUT_DRIFT_COUNT},
 * {@value #METRIC_BIAS_METRICS_COUNT}, {@value #METRIC_SAFETY_EVENTS_COUNT} and
 * {@value #METRIC_OVERALL_STATUS}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DriftCheckResult {

    public static final String METRIC_INPUT_DRIFT_COUNT = "input_drift_count";
    public static final String METRIC_OUTPUT_DRIFT_COUNT = "output_drift_count";
    public static final String METRIC_BIAS_METRICS_COUNT = "bias_metrics_count";
    public static final String METRIC_SAFETY_EVENTS_COUNT = "safety_events_count";
    public static final String METRIC_OVERALL_STATUS = "overall_status";

    private final String checkId;
    private final String modelId;
    private final String modelVersion;
    private final Instant timestamp;
    private final ExecutionStatus status;
    private final double durationMs;
    private final boolean alertGenerated;
    private final AlertLevel alertLevel;
    private final Map<String, Object> metrics;
    private final String errorMessage;
    @JsonIgnore
    private final transient DriftReport report;

    private DriftCheckResult(Builder b) {
        this.checkId = b.checkId != null ? b.checkId : UUID.randomUUID().toString();
        this.modelId = Objects.requireNonNull(b.modelId, "modelId must not be null");
        this.modelVersion = b.modelVersion;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Result status must be terminal, got: " + status);
        }
        if (b.durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0, got: " + b.durationMs);
        }
        this.durationMs = b.durationMs;
        this.alertGenerated = b.alertGenerated;
        this.alertLevel = b.alertLevel;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.metrics));
        this.errorMessage = b.errorMessage;
        this.report = b.report;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String checkId;
        private String modelId;
        private String modelVersion;
        private Instant timestamp;
        private ExecutionStatus status;
        private double durationMs;
        private boolean alertGenerated;
        private AlertLevel alertLevel;
        private Map<String, Object> metrics = Map.of();
        private String errorMessage;
        private DriftReport report;

        public Builder checkId(String checkId) {
            this.checkId = checkId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder durationMs(double durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder alertGenerated(boolean alertGenerated) {
            this.alertGenerated = alertGenerated;
            return this;
        }

        public Builder alertLevel(AlertLevel alertLevel) {
            this.alertLevel = alertLevel;
            return this;
        }

        public Builder metrics(Map<String, Object> metrics) {
            this.metrics = metrics != null ? metrics : Map.of();
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder report(DriftReport report) {
            this.report = report;
            return this;
        }

        public DriftCheckResult build() {
            return new DriftCheckResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getCheckId() {
        return checkId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public double getDurationMs() {
        return durationMs;
    }

    public boolean isAlertGenerated() {
        return alertGenerated;
    }

    /** Overall report status; {@code null} unless an alert was generated. */
    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return the full report for a completed check, or {@code null}
     */
    @JsonIgnore
    public DriftReport getReport() {
        return report;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DriftCheckResult that)) return false;
        return checkId.equals(that.checkId);
    }

    @Override
    public int hashCode() {
        return checkId.hashCode();
    }

    @Override
    public String toString() {
        return "DriftCheckResult{" +
                "checkId='" + checkId + '\'' +
                ", modelId='" + modelId + '\'' +
                ", status=" + status +
                ", alertLevel=" + alertLevel +
                ", durationMs=" + durationMs +
                (errorMessage != null ? ", errorMessage='" + errorMessage + '\'' : "") +
                '}';
    }
}
