package com.driftsentinel.scheduler.trigger;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires every {@code interval}, counted from an anchor time.
 *
 * <p>
 * Fire times are {@code anchor + k·interval} for {@code k >= 1}, so a slow
 * check never shifts later fire times.
 * </p>
 *
 * @since 1.0.0
 */
public final class FixedIntervalTrigger implements Trigger {

    private final Duration interval;
    private final ZonedDateTime anchor;

    /**
     * @param interval period between fires; must be positive
     * @param anchor   start of the first period
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public FixedIntervalTrigger(Duration interval, ZonedDateTime anchor) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.anchor = Objects.requireNonNull(anchor, "anchor must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(ZonedDateTime after) {
        long elapsed = Duration.between(anchor, after).toMillis();
        if (elapsed < 0) {
            return Optional.of(anchor.plus(interval));
        }
        long periods = elapsed / interval.toMillis() + 1;
        return Optional.of(anchor.plus(interval.multipliedBy(periods)));
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public String describe() {
        return "every " + interval;
    }

    @Override
    public String toString() {
        return "FixedIntervalTrigger{" + interval + " from " + anchor + '}';
    }
}
