package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Result of one drift detection run for a model.
 *
 * <p>
 * {@code overallStatus} is the most severe {@link AlertLevel} among the input
 * and output drift metrics. Bias metrics never raise it; they contribute
 * their own {@link SafetyEvent}s instead. A report with no drift metrics is
 * {@link AlertLevel#NORMAL}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String reportId;
    private final String modelId;
    private final String modelVersion;
    private final Instant generatedAt;
    private final TimeWindow window;
    private final List<DriftMetric> inputDrift;
    private final List<DriftMetric> outputDrift;
    private final List<BiasMetric> biasMetrics;
    private final List<SafetyEvent> safetyEvents;
    private final AlertLevel overallStatus;
    private final List<String> recommendations;

    private DriftReport(Builder b) {
        this.reportId = Objects.requireNonNull(b.reportId, "reportId must not be null");
        this.modelId = Objects.requireNonNull(b.modelId, "modelId must not be null");
        this.modelVersion = Objects.requireNonNull(b.modelVersion, "modelVersion must not be null");
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.window = Objects.requireNonNull(b.window, "window must not be null");
        this.inputDrift = List.copyOf(b.inputDrift);
        this.outputDrift = List.copyOf(b.outputDrift);
        this.biasMetrics = List.copyOf(b.biasMetrics);
        this.safetyEvents = List.copyOf(b.safetyEvents);
        this.recommendations = List.copyOf(b.recommendations);
        this.overallStatus = overallStatusOf(inputDrift, outputDrift);
    }

    /**
     * @return the pointwise maximum alert level over both metric lists,
     *         {@link AlertLevel#NORMAL} when both are empty
     */
    public static AlertLevel overallStatusOf(List<DriftMetric> input, List<DriftMetric> output) {
        return Stream.concat(input.stream(), output.stream())
                .map(DriftMetric::getAlertLevel)
                .reduce(AlertLevel.NORMAL, AlertLevel::max);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String reportId;
        private String modelId;
        private String modelVersion;
        private Instant generatedAt;
        private TimeWindow window;
        private List<DriftMetric> inputDrift = List.of();
        private List<DriftMetric> outputDrift = List.of();
        private List<BiasMetric> biasMetrics = List.of();
        private List<SafetyEvent> safetyEvents = List.of();
        private List<String> recommendations = List.of();

        public Builder reportId(String reportId) {
            this.reportId = reportId;
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

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder inputDrift(List<DriftMetric> inputDrift) {
            this.inputDrift = Objects.requireNonNull(inputDrift);
            return this;
        }

        public Builder outputDrift(List<DriftMetric> outputDrift) {
            this.outputDrift = Objects.requireNonNull(outputDrift);
            return this;
        }

        public Builder biasMetrics(List<BiasMetric> biasMetrics) {
            this.biasMetrics = Objects.requireNonNull(biasMetrics);
            return this;
        }

        public Builder safetyEvents(List<SafetyEvent> safetyEvents) {
            this.safetyEvents = Objects.requireNonNull(safetyEvents);
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = Objects.requireNonNull(recommendations);
            return this;
        }

        public DriftReport build() {
            return new DriftReport(this);
        }
    }

    public String getReportId() {
        return reportId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public List<DriftMetric> getInputDrift() {
        return inputDrift;
    }

    public List<DriftMetric> getOutputDrift() {
        return outputDrift;
    }

    public List<BiasMetric> getBiasMetrics() {
        return biasMetrics;
    }

    public List<SafetyEvent> getSafetyEvents() {
        return safetyEvents;
    }

    public AlertLevel getOverallStatus() {
        return overallStatus;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public boolean hasBiasAlerts() {
        return biasMetrics.stream().anyMatch(BiasMetric::isAlertTriggered);
    }

    @Override
    public String toString() {
        return "DriftReport{" +
                "reportId='" + reportId + '\'' +
                ", modelId='" + modelId + '\'' +
                ", modelVersion='" + modelVersion + '\'' +
                ", overallStatus=" + overallStatus +
                ", inputDrift=" + inputDrift.size() +
                ", outputDrift=" + outputDrift.size() +
                ", biasMetrics=" + biasMetrics.size() +
                ", safetyEvents=" + safetyEvents.size() +
                '}';
    }
}
