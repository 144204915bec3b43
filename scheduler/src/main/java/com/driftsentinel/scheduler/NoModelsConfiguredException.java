package com.driftsentinel.scheduler;

/**
 * Thrown by {@link DriftScheduler#start()} when no model is registered.
 *
 * @since 1.0.0
 */
public class NoModelsConfiguredException extends IllegalStateException {

    public NoModelsConfiguredException() {
        super("No models configured for drift monitoring");
    }
}
