package com.driftsentinel.core.model;

/**
 * Severity of a drift measurement.
 *
 * <p>
 * Levels are declared in ascending order of severity, so
 * {@link #ordinal()} comparisons and {@link #max(AlertLevel)} follow
 * {@code NORMAL < WARNING < CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * Classify a divergence value against a warning / critical threshold pair.
     *
     * <p>
     * Both boundaries are inclusive: a value equal to {@code critical} is
     * {@link #CRITICAL}, a value equal to {@code warning} is {@link #WARNING}.
     * </p>
     *
     * @param value    the measured divergence
     * @param warning  warning threshold
     * @param critical critical threshold
     * @return the matching level
     */
    public static AlertLevel classify(double value, double warning, double critical) {
        if (value >= critical) {
            return CRITICAL;
        }
        if (value >= warning) {
            return WARNING;
        }
        return NORMAL;
    }

    /**
     * @param other level to compare with; {@code null} is treated as
     *              {@link #NORMAL}
     * @return the more severe of {@code this} and {@code other}
     */
    public AlertLevel max(AlertLevel other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    public boolean isAtLeast(AlertLevel other) {
        return ordinal() >= other.ordinal();
    }
}
