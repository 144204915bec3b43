package com.driftsentinel.scheduler;

import com.driftsentinel.core.config.ModelDriftConfig;
import com.driftsentinel.core.config.ScheduleInterval;
import com.driftsentinel.core.detection.AlertCallback;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.DriftDetectorFactory;
import com.driftsentinel.core.detection.SafetyEventNotifier;
import com.driftsentinel.core.model.AlertDetails;
import com.driftsentinel.core.model.AlertLevel;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.scheduler.trigger.Trigger;
import com.driftsentinel.scheduler.trigger.Triggers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs drift checks for a registry of models on their configured schedules.
 *
 * <h3>Scheduling</h3>
 * <p>
 * Each enabled model gets its own chain of one-shot tasks on a shared
 * {@link ScheduledThreadPoolExecutor}: when a check finishes, the next fire
 * time is computed from the model's {@link Trigger} and scheduled. A check
 * failure is recorded as a {@link ExecutionStatus#FAILED} result and never
 * breaks the chain or touches other models.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <ul>
 *   <li>Checks of the same model run one at a time, whether triggered or
 *       requested through {@link #runScheduled}; different models run
 *       concurrently.</li>
 *   <li>The registry is guarded by a single monitor; the execution history
 *       is internally synchronized.</li>
 *   <li>Alert callbacks run synchronously on the thread executing the check;
 *       their exceptions are logged and swallowed.</li>
 * </ul>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} may be called once. {@link #stop()} cancels pending fires
 * and blocks until in-flight checks finish; running checks are never
 * interrupted. Manual runs remain available before start and after stop.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DriftScheduler.class);

    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private enum State { NEW, RUNNING, STOPPED }

    private final SchedulerConfig settings;
    private final DriftDetectorFactory detectorFactory;
    private final SafetyEventNotifier safetyNotifier;
    private final DriftDataProvider dataProvider;
    private final Clock clock;
    private final ExecutionHistory history;

    private final Object lock = new Object();
    private final Map<String, Registration> registry = new LinkedHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> checkLocks = new ConcurrentHashMap<>();
    private State state = State.NEW;
    private ScheduledThreadPoolExecutor executor;

    private DriftScheduler(Builder b) {
        this.settings = b.settings;
        this.detectorFactory = b.detectorFactory;
        this.safetyNotifier = b.safetyNotifier;
        this.dataProvider = b.dataProvider;
        this.clock = b.clock;
        this.history = new ExecutionHistory(settings.getHistoryCapacity());
    }

    public DriftScheduler() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------

    /**
     * Register a model, replacing any previous registration with the same id.
     *
     * <p>
     * The configuration is copied; later changes to {@code config} have no
     * effect. If the scheduler is running and the model is enabled, its job
     * is (re)scheduled immediately.
     * </p>
     *
     * @param config model registration
     * @throws com.driftsentinel.core.config.ConfigValidationException if the
     *         registration is invalid or its cron expression never fires
     */
    public void configureModel(ModelDriftConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        ModelDriftConfig copy = config.copy();
        // parse eagerly so a bad cron fails here instead of at start()
        Triggers.forConfig(copy, now());

        synchronized (lock) {
            Registration previous = registry.get(copy.getModelId());
            if (previous != null) {
                previous.cancel();
            }
            Registration registration = new Registration(copy);
            registry.put(copy.getModelId(), registration);
            if (state == State.RUNNING && copy.isEnabled()) {
                schedule(registration, now(), true);
            }
        }
        LOG.info("Configured drift monitoring for model [{}] v{} ({}{})",
                copy.getModelId(), copy.getModelVersion(), copy.getScheduleInterval(),
                copy.getScheduleCron() != null ? " '" + copy.getScheduleCron() + "'" : "");
    }

    /**
     * Convenience overload of {@link #configureModel(ModelDriftConfig)}.
     *
     * @param baselineData  reference samples; may be {@code null}
     * @param thresholds    threshold overrides; may be {@code null}
     * @param alertCallback invoked when a check raises an alert; may be {@code null}
     * @param scheduleCron  required for {@link ScheduleInterval#CUSTOM}
     */
    public void configureModel(String modelId, String modelVersion, ScheduleInterval scheduleInterval,
            Map<String, List<Double>> baselineData, Map<String, Double> thresholds,
            List<String> featuresToMonitor, AlertCallback alertCallback, String scheduleCron) {
        ModelDriftConfig config = new ModelDriftConfig(modelId, modelVersion, scheduleInterval);
        if (baselineData != null) {
            config.setBaselineData(baselineData);
        }
        if (thresholds != null) {
            config.setThresholds(thresholds);
        }
        config.setFeaturesToMonitor(featuresToMonitor);
        config.setAlertCallback(alertCallback);
        config.setScheduleCron(scheduleCron);
        configureModel(config);
    }

    /**
     * Unregister a model and cancel its pending fire. A check already running
     * for it completes and is recorded.
     *
     * @throws UnknownModelException if the model is not registered
     */
    public void removeModel(String modelId) {
        synchronized (lock) {
            Registration registration = registry.remove(modelId);
            if (registration == null) {
                throw new UnknownModelException(modelId);
            }
            registration.cancel();
            checkLocks.computeIfPresent(modelId, (id, l) -> l.isLocked() ? l : null);
        }
        LOG.info("Removed drift monitoring for model [{}]", modelId);
    }

    /**
     * Enable or disable a model. Disabled models still fire while the scheduler
     * runs but record {@link ExecutionStatus#SKIPPED}.
     *
     * @throws UnknownModelException if the model is not registered
     */
    public void setEnabled(String modelId, boolean enabled) {
        synchronized (lock) {
            Registration registration = requireRegistration(modelId);
            registration.config.setEnabled(enabled);
            if (enabled && state == State.RUNNING && registration.pending == null) {
                schedule(registration, now(), true);
            }
        }
        LOG.info("Model [{}] {}", modelId, enabled ? "enabled" : "disabled");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Schedule every enabled model and return.
     *
     * @throws NoModelsConfiguredException if no model is registered
     * @throws IllegalStateException       if the scheduler was already started
     */
    public void start() {
        synchronized (lock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Scheduler already started");
            }
            if (registry.isEmpty()) {
                throw new NoModelsConfiguredException();
            }
            executor = newExecutor(settings.getWorkerThreads());
            state = State.RUNNING;

            ZonedDateTime anchor = now();
            int scheduled = 0;
            for (Registration registration : registry.values()) {
                if (registration.config.isEnabled()) {
                    schedule(registration, anchor, true);
                    scheduled++;
                }
            }
            LOG.info("Drift scheduler started: {} of {} model(s) scheduled, zone {}",
                    scheduled, registry.size(), settings.getScheduleZone());
        }
    }

    /**
     * Cancel pending fires and wait for in-flight checks to finish.
     * Idempotent; a scheduler that was never started is simply marked stopped.
     */
    public void stop() {
        ScheduledThreadPoolExecutor toDrain;
        synchronized (lock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            for (Registration registration : registry.values()) {
                registration.cancel();
            }
            toDrain = executor;
        }
        if (toDrain == null) {
            LOG.info("Drift scheduler stopped before start");
            return;
        }

        LOG.info("Stopping drift scheduler, waiting for in-flight checks");
        toDrain.shutdown();
        try {
            while (!toDrain.awaitTermination(1, TimeUnit.SECONDS)) {
                LOG.debug("Still waiting for in-flight drift checks");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while waiting for in-flight drift checks", e);
            return;
        }
        LOG.info("Drift scheduler stopped");
    }

    public boolean isRunning() {
        synchronized (lock) {
            return state == State.RUNNING;
        }
    }

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------

    /**
     * Run drift checks now with caller-supplied data.
     *
     * @param modelId model to run; {@code null} runs every enabled model in
     *                registration order
     * @param data    production window; {@code null} means an empty window
     * @return the results, each also appended to the history
     * @throws UnknownModelException if {@code modelId} is not registered
     */
    public ScheduledRun runScheduled(String modelId, DriftWindowData data) {
        DriftWindowData window = data != null ? data : DriftWindowData.empty();
        if (modelId != null) {
            ModelDriftConfig config;
            synchronized (lock) {
                config = requireRegistration(modelId).config.copy();
            }
            return new ScheduledRun(List.of(execute(config, window)));
        }

        List<ModelDriftConfig> enabled = new ArrayList<>();
        synchronized (lock) {
            for (Registration registration : registry.values()) {
                if (registration.config.isEnabled()) {
                    enabled.add(registration.config.copy());
                }
            }
        }
        List<DriftCheckResult> results = new ArrayList<>(enabled.size());
        for (ModelDriftConfig config : enabled) {
            results.add(execute(config, window));
        }
        return new ScheduledRun(results);
    }

    /**
     * Run one model now; shorthand for {@code runScheduled(modelId, data).single()}.
     */
    public DriftCheckResult runModel(String modelId, DriftWindowData data) {
        return runScheduled(Objects.requireNonNull(modelId, "modelId must not be null"), data).single();
    }

    private DriftCheckResult execute(ModelDriftConfig config, DriftWindowData data) {
        ReentrantLock checkLock = checkLocks.computeIfAbsent(config.getModelId(), id -> new ReentrantLock());
        checkLock.lock();
        try {
            DriftCheckResult result = config.isEnabled()
                    ? performDriftCheck(config, data)
                    : skipped(config);
            history.record(result);
            return result;
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Score one window for one model. Never throws: any detection failure is
     * returned as a {@link ExecutionStatus#FAILED} result.
     */
    DriftCheckResult performDriftCheck(ModelDriftConfig config, DriftWindowData data) {
        String checkId = UUID.randomUUID().toString();
        CheckExecution execution = new CheckExecution(checkId, config.getModelId());
        execution.transition(ExecutionStatus.RUNNING);
        long startNanos = System.nanoTime();

        DriftCheckResult.Builder result = DriftCheckResult.builder()
                .checkId(checkId)
                .modelId(config.getModelId())
                .modelVersion(config.getModelVersion())
                .timestamp(clock.instant());
        try {
            DriftDetector detector = detectorFactory.create(config, safetyNotifier);
            DriftReport report = detector.generateReport(
                    monitoredFeatures(config, data.inputData()),
                    data.outputData(),
                    data.biasData(),
                    config.getWindowHours());

            AlertLevel overall = report.getOverallStatus();
            boolean alert = overall != AlertLevel.NORMAL;
            execution.transition(ExecutionStatus.COMPLETED);
            result.status(ExecutionStatus.COMPLETED)
                    .durationMs(elapsedMs(startNanos))
                    .alertGenerated(alert)
                    .alertLevel(alert ? overall : null)
                    .metrics(metricsOf(report))
                    .report(report);

            if (alert) {
                notifyAlert(config, report);
            }
            LOG.info("Drift check {} for model [{}] completed: {}",
                    checkId, config.getModelId(), overall);
            return result.build();
        } catch (Exception e) {
            execution.transition(ExecutionStatus.FAILED);
            LOG.error("Drift check {} for model [{}] failed", checkId, config.getModelId(), e);
            return result.status(ExecutionStatus.FAILED)
                    .durationMs(elapsedMs(startNanos))
                    .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                    .build();
        }
    }

    private DriftCheckResult skipped(ModelDriftConfig config) {
        LOG.warn("Model [{}] is disabled, skipping drift check", config.getModelId());
        CheckExecution execution = new CheckExecution(UUID.randomUUID().toString(), config.getModelId());
        execution.transition(ExecutionStatus.SKIPPED);
        return DriftCheckResult.builder()
                .checkId(execution.checkId)
                .modelId(config.getModelId())
                .modelVersion(config.getModelVersion())
                .timestamp(clock.instant())
                .status(ExecutionStatus.SKIPPED)
                .build();
    }

    private void notifyAlert(ModelDriftConfig config, DriftReport report) {
        AlertCallback callback = config.getAlertCallback();
        if (callback == null) {
            return;
        }
        try {
            callback.onAlert(config.getModelId(), AlertDetails.from(report));
        } catch (RuntimeException e) {
            LOG.error("Alert callback failed for model [{}], report {}",
                    config.getModelId(), report.getReportId(), e);
        }
    }

    private static Map<String, List<Double>> monitoredFeatures(ModelDriftConfig config,
            Map<String, List<Double>> inputData) {
        List<String> features = config.getFeaturesToMonitor();
        if (features == null) {
            return inputData;
        }
        Map<String, List<Double>> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> e : inputData.entrySet()) {
            if (features.contains(e.getKey())) {
                filtered.put(e.getKey(), e.getValue());
            } else {
                LOG.debug("Model [{}]: feature '{}' not monitored, ignoring",
                        config.getModelId(), e.getKey());
            }
        }
        return filtered;
    }

    private static Map<String, Object> metricsOf(DriftReport report) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put(DriftCheckResult.METRIC_INPUT_DRIFT_COUNT, report.getInputDrift().size());
        metrics.put(DriftCheckResult.METRIC_OUTPUT_DRIFT_COUNT, report.getOutputDrift().size());
        metrics.put(DriftCheckResult.METRIC_BIAS_METRICS_COUNT, report.getBiasMetrics().size());
        metrics.put(DriftCheckResult.METRIC_SAFETY_EVENTS_COUNT, report.getSafetyEvents().size());
        metrics.put(DriftCheckResult.METRIC_OVERALL_STATUS, report.getOverallStatus().name());
        return metrics;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    // ---------------------------------------------------------------
    // Triggered runs
    // ---------------------------------------------------------------

    /** Caller holds {@link #lock}. */
    private void schedule(Registration registration, ZonedDateTime after, boolean rebuildTrigger) {
        if (rebuildTrigger || registration.trigger == null) {
            registration.trigger = Triggers.forConfig(registration.config, after);
        }
        Optional<ZonedDateTime> next = registration.trigger.nextFireTime(after);
        if (next.isEmpty()) {
            registration.pending = null;
            registration.nextRunTime = null;
            LOG.warn("Model [{}] has no future fire time, not rescheduled",
                    registration.config.getModelId());
            return;
        }
        long delayMs = Math.max(0, Duration.between(clock.instant(), next.get().toInstant()).toMillis());
        registration.nextRunTime = next.get();
        registration.pending = executor.schedule(() -> fire(registration), delayMs, TimeUnit.MILLISECONDS);
        LOG.debug("Model [{}] next drift check at {}", registration.config.getModelId(), next.get());
    }

    private void fire(Registration registration) {
        String modelId = registration.config.getModelId();
        ModelDriftConfig config;
        ZonedDateTime served;
        synchronized (lock) {
            if (state != State.RUNNING || registry.get(modelId) != registration) {
                return;
            }
            registration.pending = null;
            served = registration.nextRunTime;
            config = registration.config.copy();
        }

        try {
            DriftWindowData data;
            try {
                data = config.isEnabled() ? dataProvider.fetch(config) : DriftWindowData.empty();
            } catch (Exception e) {
                LOG.error("Data provider failed for model [{}]", modelId, e);
                history.record(providerFailure(config, e));
                return;
            }
            execute(config, data != null ? data : DriftWindowData.empty());
        } finally {
            synchronized (lock) {
                if (state == State.RUNNING && registry.get(modelId) == registration
                        && registration.pending == null) {
                    schedule(registration, notBefore(now(), served), false);
                }
            }
        }
    }

    // the slot just served never fires again, even if the clock reads earlier
    private static ZonedDateTime notBefore(ZonedDateTime now, ZonedDateTime served) {
        return served != null && served.isAfter(now) ? served : now;
    }

    private DriftCheckResult providerFailure(ModelDriftConfig config, Exception e) {
        return DriftCheckResult.builder()
                .modelId(config.getModelId())
                .modelVersion(config.getModelVersion())
                .timestamp(clock.instant())
                .status(ExecutionStatus.FAILED)
                .errorMessage("Data provider failed: " + e.getMessage())
                .build();
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    /**
     * @throws UnknownModelException if the model is not registered
     */
    public ScheduleInfo getSchedule(String modelId) {
        synchronized (lock) {
            return requireRegistration(modelId).info();
        }
    }

    /**
     * @return schedules of every registered model in registration order
     */
    public List<ScheduleInfo> getSchedules() {
        synchronized (lock) {
            List<ScheduleInfo> out = new ArrayList<>(registry.size());
            for (Registration registration : registry.values()) {
                out.add(registration.info());
            }
            return out;
        }
    }

    public List<DriftCheckResult> getExecutionHistory() {
        return history.query(null, null, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * @param modelId only this model; {@code null} for all
     * @param status  only this status; {@code null} for all
     * @param limit   maximum entries
     * @return matching results, most recent first
     */
    public List<DriftCheckResult> getExecutionHistory(String modelId, ExecutionStatus status, int limit) {
        return history.query(modelId, status, limit);
    }

    /**
     * Statistics over the retained history; results evicted from the bounded
     * history no longer count.
     */
    public SchedulerStatistics getStatistics() {
        int configured;
        int enabled = 0;
        synchronized (lock) {
            configured = registry.size();
            for (Registration registration : registry.values()) {
                if (registration.config.isEnabled()) {
                    enabled++;
                }
            }
        }
        return history.statistics(configured, enabled);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Registration requireRegistration(String modelId) {
        Registration registration = registry.get(modelId);
        if (registration == null) {
            throw new UnknownModelException(modelId);
        }
        return registration;
    }

    private ZonedDateTime now() {
        return ZonedDateTime.ofInstant(clock.instant(), settings.getScheduleZone());
    }

    boolean hasCheckLock(String modelId) {
        return checkLocks.containsKey(modelId);
    }

    private static ScheduledThreadPoolExecutor newExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(threads, r -> {
            Thread t = new Thread(r, "drift-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        pool.setRemoveOnCancelPolicy(true);
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return pool;
    }

    /** Registry entry; mutable fields are guarded by {@link #lock}. */
    private static final class Registration {
        final ModelDriftConfig config;
        Trigger trigger;
        ScheduledFuture<?> pending;
        ZonedDateTime nextRunTime;

        Registration(ModelDriftConfig config) {
            this.config = config;
        }

        void cancel() {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            nextRunTime = null;
        }

        ScheduleInfo info() {
            return new ScheduleInfo(
                    config.getModelId(),
                    config.getModelVersion(),
                    config.getScheduleInterval(),
                    config.getScheduleCron(),
                    config.isEnabled(),
                    nextRunTime != null ? nextRunTime.toInstant() : null,
                    trigger != null ? trigger.describe() : null);
        }
    }

    /** Tracks one check through the {@link ExecutionStatus} state machine. */
    private static final class CheckExecution {
        final String checkId;
        final String modelId;
        ExecutionStatus status = ExecutionStatus.PENDING;

        CheckExecution(String checkId, String modelId) {
            this.checkId = checkId;
            this.modelId = modelId;
        }

        void transition(ExecutionStatus next) {
            if (!status.canTransitionTo(next)) {
                throw new IllegalStateException(
                        "Check " + checkId + " for model [" + modelId + "]: "
                                + status + " -> " + next + " not allowed");
            }
            status = next;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private SchedulerConfig settings = SchedulerConfig.defaults();
        private DriftDetectorFactory detectorFactory = DriftDetectorFactory.defaultFactory();
        private SafetyEventNotifier safetyNotifier;
        private DriftDataProvider dataProvider = DriftDataProvider.none();
        private Clock clock = Clock.systemUTC();

        public Builder settings(SchedulerConfig settings) {
            this.settings = settings;
            return this;
        }

        public Builder detectorFactory(DriftDetectorFactory detectorFactory) {
            this.detectorFactory = detectorFactory;
            return this;
        }

        public Builder safetyNotifier(SafetyEventNotifier safetyNotifier) {
            this.safetyNotifier = safetyNotifier;
            return this;
        }

        public Builder dataProvider(DriftDataProvider dataProvider) {
            this.dataProvider = dataProvider;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DriftScheduler build() {
            Objects.requireNonNull(settings, "settings must not be null");
            Objects.requireNonNull(detectorFactory, "detectorFactory must not be null");
            Objects.requireNonNull(dataProvider, "dataProvider must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            return new DriftScheduler(this);
        }
    }
}
