package com.driftsentinel.scheduler.trigger;

import com.driftsentinel.core.config.ConfigValidationException;
import com.driftsentinel.core.config.ModelDriftConfig;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Builds the {@link Trigger} for a model registration.
 *
 * <ul>
 *   <li>{@code HOURLY}: every hour, counted from {@code anchor}</li>
 *   <li>{@code DAILY}: every day at 00:00</li>
 *   <li>{@code WEEKLY}: every Monday at 00:00</li>
 *   <li>{@code CUSTOM}: the model's cron expression</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Triggers {

    private Triggers() {
    }

    /**
     * @param config validated model registration
     * @param anchor start time for interval schedules; carries the schedule zone
     * @return the trigger
     * @throws ConfigValidationException if the cron expression is malformed or
     *                                   never fires
     */
    public static Trigger forConfig(ModelDriftConfig config, ZonedDateTime anchor) {
        return switch (config.getScheduleInterval()) {
            case HOURLY -> new FixedIntervalTrigger(Duration.ofHours(1), anchor);
            case DAILY -> DailyTrigger.atMidnight();
            case WEEKLY -> WeeklyTrigger.mondayMidnight();
            case CUSTOM -> cronTrigger(config, anchor);
        };
    }

    private static Trigger cronTrigger(ModelDriftConfig config, ZonedDateTime anchor) {
        CronExpression cron = CronExpression.parse(config.getScheduleCron());
        if (cron.next(anchor).isEmpty()) {
            throw new ConfigValidationException("ModelDriftConfig", List.of(
                    "Model '" + config.getModelId() + "' cron '" + cron + "' never fires"));
        }
        return new CronTrigger(cron);
    }
}
