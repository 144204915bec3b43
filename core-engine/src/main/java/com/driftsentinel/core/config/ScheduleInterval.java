package com.driftsentinel.core.config;

/**
 * How often a model's drift check runs.
 *
 * @since 1.0.0
 */
public enum ScheduleInterval {

    /** Every hour, measured from scheduler start. */
    HOURLY,

    /** Every day at 00:00 in the scheduler's zone. */
    DAILY,

    /** Every Monday at 00:00 in the scheduler's zone. */
    WEEKLY,

    /** Driven by the model's {@code scheduleCron} expression. */
    CUSTOM
}
