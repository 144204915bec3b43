package com.driftsentinel.scheduler;

/**
 * Thrown when an operation names a model that is not registered.
 *
 * @since 1.0.0
 */
public class UnknownModelException extends IllegalArgumentException {

    private final String modelId;

    public UnknownModelException(String modelId) {
        super("Model not configured: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
