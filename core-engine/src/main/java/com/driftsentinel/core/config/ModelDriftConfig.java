package com.driftsentinel.core.config;

import com.driftsentinel.core.detection.AlertCallback;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drift monitoring registration for one model.
 *
 * <p>
 * Instances are plain mutable beans so that they can be populated by
 * SnakeYAML or by code. Call {@link #validate()} before handing a
 * configuration to the scheduler; the scheduler also validates on
 * registration.
 * </p>
 *
 * <p>
 * Numeric YAML values arrive as {@link Integer} or {@link Double}; the
 * setters normalise them to {@code double}.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelDriftConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default length of the reporting window. */
    public static final int DEFAULT_WINDOW_HOURS = 24;

    private String modelId;
    private String modelVersion;
    private ScheduleInterval scheduleInterval;

    /** Five-field cron expression, required for {@link ScheduleInterval#CUSTOM}. */
    private String scheduleCron;

    /** Baseline samples by feature name; {@code predictions} holds output samples. */
    private Map<String, List<Double>> baselineData = new LinkedHashMap<>();

    /** Threshold overrides keyed by name, merged over the defaults. */
    private Map<String, Double> thresholds = new LinkedHashMap<>();

    private boolean enabled = true;

    /** Features scored on each run; {@code null} means every supplied feature. */
    private List<String> featuresToMonitor;

    private int windowHours = DEFAULT_WINDOW_HOURS;

    /** Not loaded from YAML. */
    private transient AlertCallback alertCallback;

    public ModelDriftConfig() {
    }

    public ModelDriftConfig(String modelId, String modelVersion, ScheduleInterval scheduleInterval) {
        this.modelId = modelId;
        this.modelVersion = modelVersion;
        this.scheduleInterval = scheduleInterval;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the registration is complete and its thresholds are
     * consistent.
     *
     * @throws ConfigValidationException listing every violation found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (modelId == null || modelId.isBlank()) {
            errors.add("'modelId' is required");
        }
        if (modelVersion == null || modelVersion.isBlank()) {
            errors.add("Model '" + modelId + "' requires 'modelVersion'");
        }
        if (scheduleInterval == null) {
            errors.add("Model '" + modelId + "' requires 'scheduleInterval'");
        } else if (scheduleInterval == ScheduleInterval.CUSTOM
                && (scheduleCron == null || scheduleCron.isBlank())) {
            errors.add("Model '" + modelId + "' requires 'scheduleCron' for CUSTOM interval");
        }
        if (windowHours <= 0) {
            errors.add("Model '" + modelId + "' requires 'windowHours' > 0, got: " + windowHours);
        }
        if (featuresToMonitor != null && featuresToMonitor.stream().anyMatch(Objects::isNull)) {
            errors.add("Model '" + modelId + "' has a null entry in 'featuresToMonitor'");
        }
        for (String violation : resolvedThresholds().violations()) {
            errors.add("Model '" + modelId + "' " + violation);
        }

        if (!errors.isEmpty()) {
            throw new ConfigValidationException("ModelDriftConfig", errors);
        }
    }

    /**
     * @return the model's thresholds merged over {@link DriftThresholds#defaults()}
     */
    public DriftThresholds resolvedThresholds() {
        return DriftThresholds.of(thresholds);
    }

    /**
     * @return a deep copy; the alert callback is shared
     */
    public ModelDriftConfig copy() {
        ModelDriftConfig c = new ModelDriftConfig(modelId, modelVersion, scheduleInterval);
        c.scheduleCron = scheduleCron;
        c.setBaselineData(baselineData);
        c.setThresholds(thresholds);
        c.enabled = enabled;
        c.setFeaturesToMonitor(featuresToMonitor);
        c.windowHours = windowHours;
        c.alertCallback = alertCallback;
        return c;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public ScheduleInterval getScheduleInterval() {
        return scheduleInterval;
    }

    public void setScheduleInterval(ScheduleInterval scheduleInterval) {
        this.scheduleInterval = scheduleInterval;
    }

    public String getScheduleCron() {
        return scheduleCron;
    }

    public void setScheduleCron(String scheduleCron) {
        this.scheduleCron = scheduleCron;
    }

    /**
     * @return unmodifiable view of the baseline samples
     */
    public Map<String, List<Double>> getBaselineData() {
        return Collections.unmodifiableMap(baselineData);
    }

    /**
     * Replace the baseline samples (defensive copy).
     *
     * @param baselineData samples by feature name; {@code null} clears them
     * @throws IllegalArgumentException if a sample is not numeric
     */
    public void setBaselineData(Map<String, ? extends List<?>> baselineData) {
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        if (baselineData != null) {
            for (Map.Entry<String, ? extends List<?>> e : baselineData.entrySet()) {
                copy.put(e.getKey(), toDoubles(e.getKey(), e.getValue()));
            }
        }
        this.baselineData = copy;
    }

    /**
     * @return unmodifiable view of the threshold overrides
     */
    public Map<String, Double> getThresholds() {
        return Collections.unmodifiableMap(thresholds);
    }

    /**
     * Replace the threshold overrides (defensive copy).
     *
     * @param thresholds overrides by key; {@code null} clears them
     * @throws IllegalArgumentException if a value is not numeric
     */
    public void setThresholds(Map<String, ?> thresholds) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (thresholds != null) {
            for (Map.Entry<String, ?> e : thresholds.entrySet()) {
                copy.put(e.getKey(), toDouble(e.getKey(), e.getValue()));
            }
        }
        this.thresholds = copy;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getFeaturesToMonitor() {
        return featuresToMonitor != null ? Collections.unmodifiableList(featuresToMonitor) : null;
    }

    public void setFeaturesToMonitor(List<String> featuresToMonitor) {
        this.featuresToMonitor = featuresToMonitor != null ? new ArrayList<>(featuresToMonitor) : null;
    }

    public int getWindowHours() {
        return windowHours;
    }

    public void setWindowHours(int windowHours) {
        this.windowHours = windowHours;
    }

    public AlertCallback getAlertCallback() {
        return alertCallback;
    }

    public void setAlertCallback(AlertCallback alertCallback) {
        this.alertCallback = alertCallback;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Double> toDoubles(String key, List<?> values) {
        if (values == null) {
            return List.of();
        }
        List<Double> out = new ArrayList<>(values.size());
        for (Object v : values) {
            out.add(toDouble(key, v));
        }
        return Collections.unmodifiableList(out);
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException(
                "Value for '" + key + "' must be numeric, got: " + value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelDriftConfig that))
            return false;
        return Objects.equals(modelId, that.modelId)
                && Objects.equals(modelVersion, that.modelVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, modelVersion);
    }

    @Override
    public String toString() {
        return "ModelDriftConfig{" +
                "modelId='" + modelId + '\'' +
                ", modelVersion='" + modelVersion + '\'' +
                ", scheduleInterval=" + scheduleInterval +
                ", scheduleCron='" + scheduleCron + '\'' +
                ", enabled=" + enabled +
                ", baselineFeatures=" + baselineData.keySet() +
                ", thresholds=" + thresholds +
                ", featuresToMonitor=" + featuresToMonitor +
                ", windowHours=" + windowHours +
                '}';
    }
}
