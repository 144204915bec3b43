package com.driftsentinel.scheduler;

/**
 * Lifecycle of a single drift check.
 *
 * <pre>
 * PENDING ──▶ RUNNING ──▶ COMPLETED
 *    │           └──────▶ FAILED
 *    └──────────────────▶ SKIPPED
 * </pre>
 *
 * @since 1.0.0
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == SKIPPED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED, SKIPPED -> false;
        };
    }
}
