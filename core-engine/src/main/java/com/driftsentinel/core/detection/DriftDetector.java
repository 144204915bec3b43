package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.DriftThresholds;
import com.driftsentinel.core.config.ModelDriftConfig;
import com.driftsentinel.core.model.AlertLevel;
import com.driftsentinel.core.model.BiasMetric;
import com.driftsentinel.core.model.BiasObservation;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.model.PerformanceDegradation;
import com.driftsentinel.core.model.SafetyEvent;
import com.driftsentinel.core.model.SafetySeverity;
import com.driftsentinel.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Drift evaluator for one deployed model.
 *
 * <p>
 * Holds the model's baseline samples and thresholds and scores a window of
 * production data against them:
 * </p>
 * <ul>
 * <li>input drift: PSI per feature against {@code baselineData[feature]}</li>
 * <li>output drift: PSI of the predictions against
 * {@code baselineData["predictions"]}</li>
 * <li>bias drift: absolute deviation of a fairness metric per stratum</li>
 * <li>performance degradation: AUC drop against validation</li>
 * </ul>
 *
 * <h3>Missing baselines</h3>
 * <p>
 * A feature without baseline samples cannot be compared. It is reported as
 * {@link AlertLevel#NORMAL} with a value of {@code 0.0}, not as an error.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable apart from the notifier they call, and may be
 * shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    /** Baseline key holding the model's output samples. */
    public static final String PREDICTIONS_KEY = "predictions";

    static final String METRIC_PSI = "PSI";

    public static final String EVENT_DRIFT_ALERT = "DRIFT_ALERT";
    public static final String EVENT_BIAS_ALERT = "BIAS_ALERT";

    static final List<String> CRITICAL_RECOMMENDATIONS = List.of(
            "Consider pausing model deployment pending investigation",
            "Review recent data quality and pipeline changes");
    static final List<String> WARNING_RECOMMENDATIONS = List.of(
            "Monitor drift metrics closely over next 24-48 hours",
            "Prepare contingency plan for retraining if drift continues");
    static final List<String> BIAS_RECOMMENDATIONS = List.of(
            "Investigate subgroup performance degradation",
            "Review recent training data composition changes");

    private final String modelId;
    private final String modelVersion;
    private final Map<String, List<Double>> baselineData;
    private final DriftThresholds thresholds;
    private final SafetyEventNotifier notifier;
    private final Clock clock;

    /**
     * @param modelId      model identifier; must not be {@code null}
     * @param modelVersion model version; must not be {@code null}
     * @param baselineData baseline samples by feature; {@code null} means none
     * @param thresholds   thresholds; {@code null} means defaults
     * @param notifier     sink for ERROR / CRITICAL events; may be {@code null}
     * @throws com.driftsentinel.core.config.ConfigValidationException if the
     *         thresholds are inconsistent
     */
    public DriftDetector(String modelId, String modelVersion,
            Map<String, List<Double>> baselineData,
            DriftThresholds thresholds,
            SafetyEventNotifier notifier) {
        this(modelId, modelVersion, baselineData, thresholds, notifier, Clock.systemUTC());
    }

    public DriftDetector(String modelId, String modelVersion,
            Map<String, List<Double>> baselineData,
            DriftThresholds thresholds,
            SafetyEventNotifier notifier,
            Clock clock) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.modelVersion = Objects.requireNonNull(modelVersion, "modelVersion must not be null");
        this.baselineData = baselineData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(baselineData))
                : Collections.emptyMap();
        this.thresholds = thresholds != null ? thresholds : DriftThresholds.defaults();
        this.thresholds.validate();
        this.notifier = notifier;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build a detector from a model registration.
     *
     * @param config   the registration; its thresholds are merged over the
     *                 defaults
     * @param notifier sink for ERROR / CRITICAL events; may be {@code null}
     * @return a new detector
     */
    public static DriftDetector fromConfig(ModelDriftConfig config, SafetyEventNotifier notifier) {
        Objects.requireNonNull(config, "ModelDriftConfig must not be null");
        return new DriftDetector(config.getModelId(), config.getModelVersion(),
                config.getBaselineData(), config.resolvedThresholds(), notifier);
    }

    // ---------------------------------------------------------------
    // Input / output drift
    // ---------------------------------------------------------------

    public DriftMetric detectInputDrift(String featureName, List<Double> currentValues) {
        return detectInputDrift(featureName, currentValues, null);
    }

    /**
     * Score the drift of one input feature.
     *
     * @param featureName    feature being scored
     * @param currentValues  samples from the current window
     * @param baselineValues baseline override; {@code null} or empty falls
     *                       back to the stored baseline for {@code featureName}
     * @return PSI-based metric
     */
    public DriftMetric detectInputDrift(String featureName, List<Double> currentValues,
            List<Double> baselineValues) {
        Objects.requireNonNull(featureName, "featureName must not be null");
        return scorePsi(DriftType.INPUT, featureName, currentValues,
                resolveBaseline(baselineValues, featureName));
    }

    public DriftMetric detectOutputDrift(List<Double> currentPredictions) {
        return detectOutputDrift(currentPredictions, null);
    }

    /**
     * Score the drift of the model's prediction distribution.
     *
     * @param currentPredictions  predictions from the current window
     * @param baselinePredictions baseline override; {@code null} or empty
     *                            falls back to {@value #PREDICTIONS_KEY}
     * @return PSI-based metric with no feature name
     */
    public DriftMetric detectOutputDrift(List<Double> currentPredictions,
            List<Double> baselinePredictions) {
        return scorePsi(DriftType.OUTPUT, null, currentPredictions,
                resolveBaseline(baselinePredictions, PREDICTIONS_KEY));
    }

    private List<Double> resolveBaseline(List<Double> override, String key) {
        if (override != null && !override.isEmpty()) {
            return override;
        }
        return baselineData.getOrDefault(key, List.of());
    }

    private DriftMetric scorePsi(DriftType type, String featureName,
            List<Double> current, List<Double> baseline) {
        Objects.requireNonNull(current, "current values must not be null");

        DriftMetric.Builder metric = DriftMetric.builder()
                .driftType(type)
                .featureName(featureName)
                .metricName(METRIC_PSI)
                .baselineValue(0.0)
                .thresholdWarning(thresholds.getPsiWarning())
                .thresholdCritical(thresholds.getPsiCritical())
                .measuredAt(clock.instant())
                .sampleSize(current.size());

        if (baseline.isEmpty()) {
            if (!current.isEmpty()) {
                LOG.warn("Model [{}]: no baseline for '{}', reporting NORMAL",
                        modelId, featureName != null ? featureName : PREDICTIONS_KEY);
            }
            return metric.currentValue(0.0).alertLevel(AlertLevel.NORMAL).build();
        }

        double psi = DivergenceMath.psi(baseline, current);
        AlertLevel level = AlertLevel.classify(psi, thresholds.getPsiWarning(), thresholds.getPsiCritical());
        LOG.debug("Model [{}] {} drift '{}': psi={} level={}",
                modelId, type, featureName, psi, level);
        return metric.currentValue(psi).alertLevel(level).build();
    }

    // ---------------------------------------------------------------
    // Bias / performance
    // ---------------------------------------------------------------

    /**
     * Compare a fairness metric for one stratum with its baseline.
     *
     * <p>
     * The alert triggers when {@code |current − baseline| > bias_tolerance};
     * a deviation equal to the tolerance does not trigger.
     * </p>
     */
    public BiasMetric detectBiasDrift(String metricName, String stratumType, String stratumValue,
            double baselineValue, double currentValue, int sampleSize) {
        return detectBiasDrift(new BiasObservation(metricName, stratumType, stratumValue,
                baselineValue, currentValue, sampleSize));
    }

    public BiasMetric detectBiasDrift(BiasObservation observation) {
        Objects.requireNonNull(observation, "BiasObservation must not be null");
        double tolerance = thresholds.getBiasTolerance();
        double diff = Math.abs(observation.currentValue() - observation.baselineValue());
        boolean triggered = diff > tolerance;

        if (triggered) {
            LOG.debug("Model [{}] bias drift on {} for {}: |Δ|={} > tolerance={}",
                    modelId, observation.metricName(), observation.stratum(), diff, tolerance);
        }

        return BiasMetric.builder()
                .metricName(observation.metricName())
                .stratumType(observation.stratumType())
                .stratumValue(observation.stratumValue())
                .baselineValue(observation.baselineValue())
                .currentValue(observation.currentValue())
                .tolerance(tolerance)
                .alertTriggered(triggered)
                .measuredAt(clock.instant())
                .sampleSize(observation.sampleSize())
                .build();
    }

    /**
     * @param baselineAuc AUC measured at validation
     * @param currentAuc  rolling AUC on production data
     * @return degradation flag and drop; an improvement is never degraded
     */
    public PerformanceDegradation detectPerformanceDegradation(double baselineAuc, double currentAuc) {
        double drop = baselineAuc - currentAuc;
        return new PerformanceDegradation(drop > thresholds.getAucDropThreshold(), drop);
    }

    // ---------------------------------------------------------------
    // Safety events
    // ---------------------------------------------------------------

    /**
     * Create a safety event and, for ERROR and CRITICAL severities, push it to
     * the notifier before returning it.
     *
     * <p>
     * A notifier failure is logged; the event is still returned.
     * </p>
     */
    public SafetyEvent createSafetyEvent(String eventType, SafetySeverity severity,
            String description, Map<String, Object> details) {
        SafetyEvent event = SafetyEvent.builder()
                .modelId(modelId)
                .eventType(eventType)
                .severity(severity)
                .description(description)
                .details(details)
                .createdAt(clock.instant())
                .build();

        if (notifier != null && severity.requiresNotification()) {
            try {
                notifier.onSafetyEvent(event);
            } catch (RuntimeException e) {
                LOG.error("Safety-event notifier failed for event {} of model [{}]",
                        event.getEventId(), modelId, e);
            }
        }
        return event;
    }

    // ---------------------------------------------------------------
    // Report
    // ---------------------------------------------------------------

    public DriftReport generateReport(Map<String, List<Double>> inputData, List<Double> outputData,
            List<BiasObservation> biasData) {
        return generateReport(inputData, outputData, biasData, ModelDriftConfig.DEFAULT_WINDOW_HOURS);
    }

    /**
     * Score a full window of production data.
     *
     * <p>
     * Every CRITICAL input or output metric raises a {@value #EVENT_DRIFT_ALERT}
     * event and every triggered bias metric a {@value #EVENT_BIAS_ALERT} event,
     * both with {@link SafetySeverity#WARNING} severity so that they request
     * human review without pausing the model.
     * </p>
     *
     * @param inputData   current samples by feature name
     * @param outputData  current predictions
     * @param biasData    fairness measurements; {@code null} means none
     * @param windowHours length of the reporting window ending now
     * @return the report
     * @throws IllegalArgumentException if a sample is not finite
     */
    public DriftReport generateReport(Map<String, List<Double>> inputData, List<Double> outputData,
            List<BiasObservation> biasData, int windowHours) {
        Objects.requireNonNull(inputData, "inputData must not be null");
        Objects.requireNonNull(outputData, "outputData must not be null");

        Instant now = clock.instant();
        TimeWindow window = TimeWindow.endingAt(now, windowHours);

        List<DriftMetric> inputDrift = new ArrayList<>();
        for (Map.Entry<String, List<Double>> e : inputData.entrySet()) {
            inputDrift.add(detectInputDrift(e.getKey(), e.getValue()).withWindow(window));
        }
        List<DriftMetric> outputDrift = List.of(detectOutputDrift(outputData).withWindow(window));

        List<BiasMetric> biasMetrics = new ArrayList<>();
        if (biasData != null) {
            for (BiasObservation observation : biasData) {
                biasMetrics.add(detectBiasDrift(observation).withWindow(window));
            }
        }

        List<SafetyEvent> events = new ArrayList<>();
        List<DriftMetric> driftMetrics = new ArrayList<>(inputDrift);
        driftMetrics.addAll(outputDrift);
        for (DriftMetric metric : driftMetrics) {
            if (metric.getAlertLevel() == AlertLevel.CRITICAL) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("drift_type", metric.getDriftType().name());
                details.put("metric_name", metric.getMetricName());
                details.put("current_value", metric.getCurrentValue());
                details.put("threshold", metric.getThresholdCritical());
                events.add(createSafetyEvent(EVENT_DRIFT_ALERT, SafetySeverity.WARNING,
                        "Critical drift detected in " + metric.subject(), details));
            }
        }
        for (BiasMetric bias : biasMetrics) {
            if (bias.isAlertTriggered()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("metric_name", bias.getMetricName());
                details.put("stratum", bias.getStratumType() + "=" + bias.getStratumValue());
                details.put("baseline", bias.getBaselineValue());
                details.put("current", bias.getCurrentValue());
                details.put("tolerance", bias.getTolerance());
                events.add(createSafetyEvent(EVENT_BIAS_ALERT, SafetySeverity.WARNING,
                        "Bias drift detected: " + bias.getMetricName() + " for "
                                + bias.getStratumType() + "=" + bias.getStratumValue(),
                        details));
            }
        }

        AlertLevel overall = DriftReport.overallStatusOf(inputDrift, outputDrift);
        boolean biasAlert = biasMetrics.stream().anyMatch(BiasMetric::isAlertTriggered);

        DriftReport report = DriftReport.builder()
                .reportId(UUID.randomUUID().toString())
                .modelId(modelId)
                .modelVersion(modelVersion)
                .generatedAt(now)
                .window(window)
                .inputDrift(inputDrift)
                .outputDrift(outputDrift)
                .biasMetrics(biasMetrics)
                .safetyEvents(events)
                .recommendations(recommendationsFor(overall, biasAlert))
                .build();

        LOG.debug("Model [{}] v{} report {}: status={} events={}",
                modelId, modelVersion, report.getReportId(), report.getOverallStatus(), events.size());
        return report;
    }

    static List<String> recommendationsFor(AlertLevel overall, boolean biasAlert) {
        List<String> recommendations = new ArrayList<>();
        switch (overall) {
            case CRITICAL -> recommendations.addAll(CRITICAL_RECOMMENDATIONS);
            case WARNING -> recommendations.addAll(WARNING_RECOMMENDATIONS);
            default -> {
                // nothing to recommend
            }
        }
        if (biasAlert) {
            recommendations.addAll(BIAS_RECOMMENDATIONS);
        }
        return recommendations;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getModelId() {
        return modelId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public DriftThresholds getThresholds() {
        return thresholds;
    }

    public Map<String, List<Double>> getBaselineData() {
        return baselineData;
    }
}
