package com.driftsentinel.core.model;

/**
 * Outcome of comparing a rolling production AUC with the validation AUC.
 *
 * @param degraded {@code true} when {@code drop} exceeds the configured limit
 * @param drop     {@code baselineAuc - currentAuc}; negative when the model
 *                 improved
 * @since 1.0.0
 */
public record PerformanceDegradation(boolean degraded, double drop) {
}
