package com.driftsentinel.core.model;

/**
 * Severity of a {@link SafetyEvent}.
 *
 * @since 1.0.0
 */
public enum SafetySeverity {

    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * @return {@code true} for severities that are pushed to the safety-event
     *         notifier ({@link #ERROR} and {@link #CRITICAL})
     */
    public boolean requiresNotification() {
        return this == ERROR || this == CRITICAL;
    }
}
