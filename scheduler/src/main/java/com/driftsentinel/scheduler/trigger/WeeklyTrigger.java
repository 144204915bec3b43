package com.driftsentinel.scheduler.trigger;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once a week on a fixed day and local time.
 *
 * @since 1.0.0
 */
public final class WeeklyTrigger implements Trigger {

    private final DayOfWeek day;
    private final LocalTime at;

    public WeeklyTrigger(DayOfWeek day, LocalTime at) {
        this.day = Objects.requireNonNull(day, "day must not be null");
        this.at = Objects.requireNonNull(at, "time of day must not be null");
    }

    public static WeeklyTrigger mondayMidnight() {
        return new WeeklyTrigger(DayOfWeek.MONDAY, LocalTime.MIDNIGHT);
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(ZonedDateTime after) {
        LocalDate date = after.toLocalDate().with(TemporalAdjusters.nextOrSame(day));
        ZonedDateTime candidate = ZonedDateTime.of(date, at, after.getZone());
        if (!candidate.isAfter(after)) {
            candidate = ZonedDateTime.of(date.plusWeeks(1), at, after.getZone());
        }
        return Optional.of(candidate);
    }

    @Override
    public String describe() {
        return "weekly on " + day + " at " + at;
    }

    @Override
    public String toString() {
        return "WeeklyTrigger{" + day + ' ' + at + '}';
    }
}
