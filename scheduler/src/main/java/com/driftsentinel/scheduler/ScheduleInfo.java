package com.driftsentinel.scheduler;

import com.driftsentinel.core.config.ScheduleInterval;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Schedule of one registered model.
 *
 * @param modelId          model identifier
 * @param modelVersion     model version
 * @param scheduleInterval configured interval
 * @param scheduleCron     cron expression for {@code CUSTOM}, otherwise {@code null}
 * @param enabled          whether scheduled fires run the check
 * @param nextRunTime      next fire time; {@code null} while the scheduler is
 *                         not running or the model has no pending fire
 * @param trigger          human-readable trigger description
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleInfo(
        String modelId,
        String modelVersion,
        ScheduleInterval scheduleInterval,
        String scheduleCron,
        boolean enabled,
        Instant nextRunTime,
        String trigger) {
}
