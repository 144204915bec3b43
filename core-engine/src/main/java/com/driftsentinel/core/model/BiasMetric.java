package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Fairness metric measured for one stratum, compared with its baseline.
 *
 * <p>
 * {@code alertTriggered} is set when the absolute deviation from the baseline
 * strictly exceeds {@code tolerance}. There is no severity tiering.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BiasMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final String stratumType;
    private final String stratumValue;
    private final double baselineValue;
    private final double currentValue;
    private final double tolerance;
    private final boolean alertTriggered;
    private final Instant measuredAt;
    private final TimeWindow window;
    private final int sampleSize;

    private BiasMetric(Builder b) {
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.stratumType = Objects.requireNonNull(b.stratumType, "stratumType must not be null");
        this.stratumValue = Objects.requireNonNull(b.stratumValue, "stratumValue must not be null");
        this.baselineValue = b.baselineValue;
        this.currentValue = b.currentValue;
        this.tolerance = b.tolerance;
        this.alertTriggered = b.alertTriggered;
        this.measuredAt = Objects.requireNonNull(b.measuredAt, "measuredAt must not be null");
        this.window = b.window;
        this.sampleSize = b.sampleSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public BiasMetric withWindow(TimeWindow window) {
        return new Builder()
                .metricName(metricName)
                .stratumType(stratumType)
                .stratumValue(stratumValue)
                .baselineValue(baselineValue)
                .currentValue(currentValue)
                .tolerance(tolerance)
                .alertTriggered(alertTriggered)
                .measuredAt(measuredAt)
                .window(window)
                .sampleSize(sampleSize)
                .build();
    }

    public static class Builder {
        private String metricName;
        private String stratumType;
        private String stratumValue;
        private double baselineValue;
        private double currentValue;
        private double tolerance;
        private boolean alertTriggered;
        private Instant measuredAt;
        private TimeWindow window;
        private int sampleSize;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder stratumType(String stratumType) {
            this.stratumType = stratumType;
            return this;
        }

        public Builder stratumValue(String stratumValue) {
            this.stratumValue = stratumValue;
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

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder alertTriggered(boolean alertTriggered) {
            this.alertTriggered = alertTriggered;
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

        public BiasMetric build() {
            return new BiasMetric(this);
        }
    }

    public String getMetricName() {
        return metricName;
    }

    public String getStratumType() {
        return stratumType;
    }

    public String getStratumValue() {
        return stratumValue;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean isAlertTriggered() {
        return alertTriggered;
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

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BiasMetric that))
            return false;
        return metricName.equals(that.metricName)
                && stratumType.equals(that.stratumType)
                && stratumValue.equals(that.stratumValue)
                && Double.compare(currentValue, that.currentValue) == 0
                && measuredAt.equals(that.measuredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, stratumType, stratumValue, currentValue, measuredAt);
    }

    @Override
    public String toString() {
        return "BiasMetric{" +
                "metricName='" + metricName + '\'' +
                ", stratum=" + stratumType + '=' + stratumValue +
                ", baselineValue=" + baselineValue +
                ", currentValue=" + currentValue +
                ", tolerance=" + tolerance +
                ", alertTriggered=" + alertTriggered +
                '}';
    }
}
