package com.driftsentinel.scheduler;

import java.util.List;

/**
 * Results of a manual run.
 *
 * <p>
 * A run that produced exactly one result is <em>single</em> and exposes it via
 * {@link #single()}; otherwise (every enabled model was run, and zero or
 * several ran) the results are read as a list via {@link #results()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScheduledRun {

    private final List<DriftCheckResult> results;

    ScheduledRun(List<DriftCheckResult> results) {
        this.results = List.copyOf(results);
    }

    public boolean isSingle() {
        return results.size() == 1;
    }

    /**
     * @return the only result
     * @throws IllegalStateException if the run did not produce exactly one result
     */
    public DriftCheckResult single() {
        if (!isSingle()) {
            throw new IllegalStateException(
                    "Run produced " + results.size() + " results; use results()");
        }
        return results.get(0);
    }

    /**
     * @return every result in run order
     */
    public List<DriftCheckResult> results() {
        return results;
    }

    @Override
    public String toString() {
        return "ScheduledRun{" + results + '}';
    }
}
