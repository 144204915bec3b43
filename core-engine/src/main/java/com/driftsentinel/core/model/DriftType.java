package com.driftsentinel.core.model;

/**
 * Kind of distribution shift a {@link DriftMetric} measures.
 *
 * @since 1.0.0
 */
public enum DriftType {

    /** Shift in an input feature distribution. */
    INPUT,

    /** Shift in the model's prediction distribution. */
    OUTPUT,

    /** Shift in the relationship between inputs and the target. */
    CONCEPT
}
