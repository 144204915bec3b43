package com.driftsentinel.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of scheduler activity, computed over the retained history.
 *
 * @param totalModelsConfigured registered models
 * @param totalModelsEnabled    registered and enabled models
 * @param totalExecutions       retained results
 * @param successfulExecutions  results with {@link ExecutionStatus#COMPLETED}
 * @param failedExecutions      results with {@link ExecutionStatus#FAILED}
 * @param skippedExecutions     results with {@link ExecutionStatus#SKIPPED}
 * @param alertsGenerated       results that raised an alert
 * @since 1.0.0
 */
public record SchedulerStatistics(
        int totalModelsConfigured,
        int totalModelsEnabled,
        int totalExecutions,
        int successfulExecutions,
        int failedExecutions,
        int skippedExecutions,
        int alertsGenerated) {

    /**
     * @return completed executions as a percentage of all executions, or 0
     *         when there are none
     */
    @JsonProperty("success_rate")
    public double successRate() {
        if (totalExecutions == 0) {
            return 0.0;
        }
        return (double) successfulExecutions / totalExecutions * 100.0;
    }
}
