package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]} covered by a detection run.
 *
 * @since 1.0.0
 */
public final class TimeWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final Instant end;

    /**
     * @param start window start; must not be {@code null}
     * @param end   window end; must not be {@code null} nor before {@code start}
     * @throws IllegalArgumentException if {@code end} is before {@code start}
     */
    public TimeWindow(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "Window start must not be null");
        this.end = Objects.requireNonNull(end, "Window end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(
                    "Window end " + end + " is before start " + start);
        }
    }

    /**
     * Window of the given number of hours ending at {@code end}.
     *
     * @param end   window end
     * @param hours window length in hours; must be &gt; 0
     * @return the window {@code [end - hours, end]}
     */
    public static TimeWindow endingAt(Instant end, int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("Window hours must be > 0, got: " + hours);
        }
        return new TimeWindow(end.minus(Duration.ofHours(hours)), end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
