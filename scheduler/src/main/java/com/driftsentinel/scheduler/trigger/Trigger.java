package com.driftsentinel.scheduler.trigger;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes when a model's drift check fires next.
 *
 * <p>
 * Implementations are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface Trigger {

    /**
     * @param after reference time
     * @return the first fire time strictly after {@code after}, or empty if
     *         the trigger never fires again
     */
    Optional<ZonedDateTime> nextFireTime(ZonedDateTime after);

    /**
     * @return short human-readable description, e.g. {@code every PT1H}
     */
    String describe();
}
