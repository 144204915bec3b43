package com.driftsentinel.scheduler;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Typed, immutable settings for a {@link DriftScheduler}.
 *
 * <p>
 * Values are resolved from environment variables with defaults:
 * </p>
 * <ul>
 *   <li>{@code DRIFT_HISTORY_CAPACITY} (1000): retained check results</li>
 *   <li>{@code DRIFT_WORKER_THREADS} (4): threads running scheduled checks</li>
 *   <li>{@code DRIFT_SCHEDULE_ZONE} (UTC): zone for daily, weekly and cron schedules</li>
 *   <li>{@code DRIFT_MODELS_CONFIG_PATH} (empty): YAML model registrations;
 *       empty means the {@code models.yml} classpath resource</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SchedulerConfig {

    private final int historyCapacity;
    private final int workerThreads;
    private final ZoneId scheduleZone;
    private final String modelsConfigPath;

    private SchedulerConfig(Builder b) {
        this.historyCapacity = b.historyCapacity;
        this.workerThreads = b.workerThreads;
        this.scheduleZone = b.scheduleZone;
        this.modelsConfigPath = b.modelsConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SchedulerConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration resolved from environment variables
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static SchedulerConfig fromEnvironment() {
        try {
            return new Builder()
                    .historyCapacity(parseIntEnv("DRIFT_HISTORY_CAPACITY", "1000"))
                    .workerThreads(parseIntEnv("DRIFT_WORKER_THREADS", "4"))
                    .scheduleZone(ZoneId.of(env("DRIFT_SCHEDULE_ZONE", "UTC")))
                    .modelsConfigPath(env("DRIFT_MODELS_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalStateException(
                    "Failed to parse environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public ZoneId getScheduleZone() {
        return scheduleZone;
    }

    public String getModelsConfigPath() {
        return modelsConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder; {@link #build()} rejects a capacity or thread count
     * below 1.
     */
    public static class Builder {
        private int historyCapacity = ExecutionHistory.DEFAULT_CAPACITY;
        private int workerThreads = 4;
        private ZoneId scheduleZone = ZoneId.of("UTC");
        private String modelsConfigPath = "";

        public Builder historyCapacity(int v) {
            this.historyCapacity = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder scheduleZone(ZoneId v) {
            this.scheduleZone = v;
            return this;
        }

        public Builder modelsConfigPath(String v) {
            this.modelsConfigPath = v;
            return this;
        }

        public SchedulerConfig build() {
            Objects.requireNonNull(scheduleZone, "scheduleZone required");
            if (historyCapacity < 1) {
                throw new IllegalArgumentException(
                        "historyCapacity must be >= 1, got: " + historyCapacity);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException(
                        "workerThreads must be >= 1, got: " + workerThreads);
            }
            if (modelsConfigPath == null) {
                modelsConfigPath = "";
            }
            return new SchedulerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "historyCapacity=" + historyCapacity +
                ", workerThreads=" + workerThreads +
                ", scheduleZone=" + scheduleZone +
                ", modelsConfigPath='" + modelsConfigPath + '\'' +
                '}';
    }
}
