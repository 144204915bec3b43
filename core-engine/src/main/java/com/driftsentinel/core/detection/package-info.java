/**
 * Drift scoring engine.
 *
 * <p>
 * {@link com.driftsentinel.core.detection.DivergenceMath} holds the pure PSI
 * and KL divergence functions.
 * {@link com.driftsentinel.core.detection.DriftDetector} applies them to one
 * model's baselines and thresholds and assembles a
 * {@link com.driftsentinel.core.model.DriftReport}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * Supply a custom {@link com.driftsentinel.core.detection.DriftDetectorFactory}
 * to change how detectors are built for scheduled checks, for example to load
 * baselines from a store.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.detection;
