package com.driftsentinel.scheduler;

import com.driftsentinel.core.config.ModelDriftConfig;

/**
 * Supplies the production data a scheduled drift check scores.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DriftDataProvider {

    /**
     * @param config registration of the model being checked
     * @return data for the model's current window
     */
    DriftWindowData fetch(ModelDriftConfig config);

    /**
     * @return a provider that always returns {@link DriftWindowData#empty()}
     */
    static DriftDataProvider none() {
        return config -> DriftWindowData.empty();
    }
}
