/**
 * Domain model for drift monitoring.
 *
 * <p>
 * All types in this package are immutable value objects produced by the
 * detection engine:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.model.DriftMetric}: PSI measurement for a
 * feature or for the predictions</li>
 * <li>{@link com.driftsentinel.core.model.BiasMetric}: fairness metric per
 * stratum</li>
 * <li>{@link com.driftsentinel.core.model.SafetyEvent}: incident raised for
 * human review</li>
 * <li>{@link com.driftsentinel.core.model.DriftReport}: aggregate of one
 * detection run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
