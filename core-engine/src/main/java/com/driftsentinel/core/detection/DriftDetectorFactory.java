package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.ModelDriftConfig;

/**
 * Builds the {@link DriftDetector} used for one check of a model.
 *
 * <p>
 * The scheduler calls the factory once per check, so a factory may read
 * fresh baselines on each call. The default is
 * {@link DriftDetector#fromConfig(ModelDriftConfig, SafetyEventNotifier)}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DriftDetectorFactory {

    /**
     * @param config   the model registration
     * @param notifier safety-event sink to hand to the detector; may be
     *                 {@code null}
     * @return a detector for {@code config}
     */
    DriftDetector create(ModelDriftConfig config, SafetyEventNotifier notifier);

    static DriftDetectorFactory defaultFactory() {
        return DriftDetector::fromConfig;
    }
}
