package com.driftsentinel.core.model;

import java.io.Serializable;

/**
 * Caller-supplied fairness measurement for one stratum in the current window.
 *
 * <p>
 * This is the input counterpart of {@link BiasMetric}: the data provider
 * reports the baseline and current value, the detector decides whether the
 * deviation is tolerable.
 * </p>
 *
 * @param metricName    fairness metric, e.g. {@code demographic_parity_gap}
 * @param stratumType   stratification axis, e.g. {@code RACE}
 * @param stratumValue  stratum within that axis
 * @param baselineValue value observed at validation time
 * @param currentValue  value observed in the current window
 * @param sampleSize    number of samples behind {@code currentValue}
 * @since 1.0.0
 */
public record BiasObservation(
        String metricName,
        String stratumType,
        String stratumValue,
        double baselineValue,
        double currentValue,
        int sampleSize) implements Serializable {

    public BiasObservation {
        metricName = metricName != null ? metricName : "unknown";
        stratumType = stratumType != null ? stratumType : "CUSTOM";
        stratumValue = stratumValue != null ? stratumValue : "unknown";
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be >= 0, got: " + sampleSize);
        }
    }

    public static BiasObservation of(String metricName, String stratumType, String stratumValue,
            double baselineValue, double currentValue) {
        return new BiasObservation(metricName, stratumType, stratumValue, baselineValue, currentValue, 0);
    }

    /**
     * @return {@code stratumType=stratumValue}
     */
    public String stratum() {
        return stratumType + "=" + stratumValue;
    }
}
