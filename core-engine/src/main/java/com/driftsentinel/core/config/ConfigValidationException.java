package com.driftsentinel.core.config;

import java.util.List;

/**
 * Thrown when a drift monitoring configuration is malformed.
 *
 * <p>
 * Carries every violation found, not only the first one.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ConfigValidationException(String subject, List<String> errors) {
        super("Invalid " + subject + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
