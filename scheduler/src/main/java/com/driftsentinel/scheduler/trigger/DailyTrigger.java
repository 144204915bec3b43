package com.driftsentinel.scheduler.trigger;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once a day at a fixed local time in the zone of the reference time.
 *
 * @since 1.0.0
 */
public final class DailyTrigger implements Trigger {

    private final LocalTime at;

    public DailyTrigger(LocalTime at) {
        this.at = Objects.requireNonNull(at, "time of day must not be null");
    }

    public static DailyTrigger atMidnight() {
        return new DailyTrigger(LocalTime.MIDNIGHT);
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(ZonedDateTime after) {
        ZonedDateTime candidate = ZonedDateTime.of(after.toLocalDate(), at, after.getZone());
        if (!candidate.isAfter(after)) {
            candidate = ZonedDateTime.of(after.toLocalDate().plusDays(1), at, after.getZone());
        }
        return Optional.of(candidate);
    }

    @Override
    public String describe() {
        return "daily at " + at;
    }

    @Override
    public String toString() {
        return "DailyTrigger{" + at + '}';
    }
}
