package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One drift measurement for a single input feature or for the model output.
 *
 * <p>
 * Instances are immutable. A detection run creates one metric per monitored
 * feature plus one for the predictions; {@link #withWindow(TimeWindow)}
 * returns a copy bound to the run's reporting window.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code driftType}, {@code metricName},
 * {@code alertLevel} and {@code measuredAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DriftMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DriftType driftType;

    /** Feature name; {@code null} for output drift. */
    private final String featureName;

    private final String metricName;
    private final double baselineValue;
    private final double currentValue;
    private final double thresholdWarning;
    private final double thresholdCritical;
    private final AlertLevel alertLevel;
    private final Instant measuredAt;

    /** Reporting window; {@code null} for standalone measurements. */
    private final TimeWindow window;

    private final int sampleSize;

    private DriftMetric(Builder b) {
        this.driftType = Objects.requireNonNull(b.driftType, "driftType must not be null");
        this.featureName = b.featureName;
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.baselineValue = b.baselineValue;
        this.currentValue = b.currentValue;
        this.thresholdWarning = b.thresholdWarning;
        this.thresholdCritical = b.thresholdCritical;
        this.alertLevel = Objects.requireNonNull(b.alertLevel, "alertLevel must not be null");
        this.measuredAt = Objects.requireNonNull(b.measuredAt, "measuredAt must not be null");
        this.window = b.window;
        this.sampleSize = b.sampleSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param window reporting window to attach
     * @return a copy of this metric carrying {@code window}
     */
    public DriftMetric withWindow(TimeWindow window) {
        return toBuilder().window(window).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .driftType(driftType)
                .featureName(featureName)
                .metricName(metricName)
                .baselineValue(baselineValue)
                .currentValue(currentValue)
                .thresholdWarning(thresholdWarning)
                .thresholdCritical(thresholdCritical)
                .alertLevel(alertLevel)
                .measuredAt(measuredAt)
                .window(window)
                .sampleSize(sampleSize);
    }

    /**
     * Fluent builder for {@link DriftMetric}.
     */
    public static class Builder {
        private DriftType driftType;
        private String featureName;
        private String metricName;
        private double baselineValue;
        private double currentValue;
        private double thresholdWarning;
        private double thresholdCritical;
        private AlertLevel alertLevel;
        private Instant measuredAt;
        private TimeWindow window;
        private int sampleSize;

        public Builder driftType(DriftType driftType) {
            this.driftType = driftType;
            return this;
        }

        public Builder featureName(String featureName) {
            this.featureName = featureName;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder thresholdWarning(double thresholdWarning) {
            this.thresholdWarning = thresholdWarning;
            return this;
        }

        public Builder thresholdCritical(double thresholdCritical) {
            this.thresholdCritical = thresholdCritical;
            return this;
        }

        public Builder alertLevel(AlertLevel alertLevel) {
            this.alertLevel = alertLevel;
            return this;
        }

        public Builder measuredAt(Instant measuredAt) {
            this.measuredAt = measuredAt;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        /**
         * @return a new {@link DriftMetric}
         * @throws NullPointerException if a required field is missing
         */
        public DriftMetric build() {
            return new DriftMetric(this);
        }
    }

    public DriftType getDriftType() {
        return driftType;
    }

    public String getFeatureName() {
        return featureName;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getThresholdWarning() {
        return thresholdWarning;
    }

    public double getThresholdCritical() {
        return thresholdCritical;
    }

    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    public Instant getMeasuredAt() {
        return measuredAt;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @return the feature name, or {@code "predictions"} for output drift
     */
    public String subject() {
        return featureName != null ? featureName : "predictions";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftMetric that))
            return false;
        return driftType == that.driftType
                && Objects.equals(featureName, that.featureName)
                && metricName.equals(that.metricName)
                && Double.compare(currentValue, that.currentValue) == 0
                && measuredAt.equals(that.measuredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(driftType, featureName, metricName, currentValue, measuredAt);
    }

    @Override
    public String toString() {
        return "DriftMetric{" +
                "driftType=" + driftType +
                ", featureName='" + featureName + '\'' +
                ", metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", alertLevel=" + alertLevel +
                ", sampleSize=" + sampleSize +
                '}';
    }
}
