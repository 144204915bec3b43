package com.driftsentinel.scheduler.trigger;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires on every minute matched by a {@link CronExpression}.
 *
 * @since 1.0.0
 */
public final class CronTrigger implements Trigger {

    private final CronExpression cron;

    public CronTrigger(CronExpression cron) {
        this.cron = Objects.requireNonNull(cron, "cron must not be null");
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(ZonedDateTime after) {
        return cron.next(after);
    }

    public CronExpression getCron() {
        return cron;
    }

    @Override
    public String describe() {
        return "cron '" + cron.getExpression() + "'";
    }

    @Override
    public String toString() {
        return "CronTrigger{" + cron + '}';
    }
}
