package com.driftsentinel.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, thread-safe log of drift check results.
 *
 * <p>
 * Appends evict the oldest entry once {@link #capacity()} is reached. Every
 * operation holds the instance monitor, so each append is atomic with respect
 * to readers.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExecutionHistory {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<DriftCheckResult> entries;

    public ExecutionHistory() {
        this(DEFAULT_CAPACITY);
    }

    public ExecutionHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void record(DriftCheckResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(result);
    }

    /**
     * @return every retained entry, oldest first
     */
    public synchronized List<DriftCheckResult> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Filter the history, most recent first.
     *
     * @param modelId only this model; {@code null} for all
     * @param status  only this status; {@code null} for all
     * @param limit   maximum number of entries returned
     * @return matching entries
     */
    public synchronized List<DriftCheckResult> query(String modelId, ExecutionStatus status, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        List<DriftCheckResult> out = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<DriftCheckResult> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            DriftCheckResult r = it.next();
            if (modelId != null && !modelId.equals(r.getModelId())) continue;
            if (status != null && status != r.getStatus()) continue;
            out.add(r);
        }
        return out;
    }

    /**
     * Aggregate the retained entries.
     *
     * @param modelsConfigured registered models
     * @param modelsEnabled    enabled models
     * @return statistics over the retained entries
     */
    public synchronized SchedulerStatistics statistics(int modelsConfigured, int modelsEnabled) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        int alerts = 0;
        for (DriftCheckResult r : entries) {
            switch (r.getStatus()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> {
                }
            }
            if (r.isAlertGenerated()) {
                alerts++;
            }
        }
        return new SchedulerStatistics(modelsConfigured, modelsEnabled, entries.size(),
                completed, failed, skipped, alerts);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
