package com.driftsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Threshold set used by a drift detector.
 *
 * <p>
 * The well-known thresholds are typed fields. Any other key found in a
 * configuration map is kept in {@link #getCustom()} so that newer
 * configuration files still load.
 * </p>
 *
 * <table>
 * <caption>Defaults</caption>
 * <tr><th>key</th><th>default</th></tr>
 * <tr><td>{@value #PSI_WARNING}</td><td>0.1</td></tr>
 * <tr><td>{@value #PSI_CRITICAL}</td><td>0.25</td></tr>
 * <tr><td>{@value #KL_WARNING}</td><td>0.1</td></tr>
 * <tr><td>{@value #KL_CRITICAL}</td><td>0.2</td></tr>
 * <tr><td>{@value #BIAS_TOLERANCE}</td><td>0.05</td></tr>
 * <tr><td>{@value #AUC_DROP_THRESHOLD}</td><td>0.05</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class DriftThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PSI_WARNING = "psi_warning";
    public static final String PSI_CRITICAL = "psi_critical";
    public static final String KL_WARNING = "kl_warning";
    public static final String KL_CRITICAL = "kl_critical";
    public static final String BIAS_TOLERANCE = "bias_tolerance";
    public static final String AUC_DROP_THRESHOLD = "auc_drop_threshold";

    private static final DriftThresholds DEFAULTS =
            new DriftThresholds(0.1, 0.25, 0.1, 0.2, 0.05, 0.05, Map.of());

    private final double psiWarning;
    private final double psiCritical;
    private final double klWarning;
    private final double klCritical;
    private final double biasTolerance;
    private final double aucDropThreshold;
    private final Map<String, Double> custom;

    private DriftThresholds(double psiWarning, double psiCritical,
            double klWarning, double klCritical,
            double biasTolerance, double aucDropThreshold,
            Map<String, Double> custom) {
        this.psiWarning = psiWarning;
        this.psiCritical = psiCritical;
        this.klWarning = klWarning;
        this.klCritical = klCritical;
        this.biasTolerance = biasTolerance;
        this.aucDropThreshold = aucDropThreshold;
        this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(custom));
    }

    public static DriftThresholds defaults() {
        return DEFAULTS;
    }

    /**
     * Overlay a key/value map on the defaults.
     *
     * @param overrides threshold overrides; {@code null} means none
     * @return merged thresholds (not yet validated)
     */
    public static DriftThresholds of(Map<String, Double> overrides) {
        return DEFAULTS.merge(overrides);
    }

    /**
     * Overlay a key/value map on this threshold set.
     *
     * <p>
     * Known keys replace the typed fields; unknown keys are collected as
     * custom thresholds.
     * </p>
     *
     * @param overrides threshold overrides; {@code null} means none
     * @return a new instance (not yet validated)
     */
    public DriftThresholds merge(Map<String, Double> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        double pw = psiWarning;
        double pc = psiCritical;
        double kw = klWarning;
        double kc = klCritical;
        double bt = biasTolerance;
        double ad = aucDropThreshold;
        Map<String, Double> extra = new LinkedHashMap<>(custom);

        for (Map.Entry<String, Double> e : overrides.entrySet()) {
            String key = Objects.requireNonNull(e.getKey(), "Threshold key must not be null");
            double value = Objects.requireNonNull(e.getValue(),
                    "Threshold '" + key + "' must not be null");
            switch (key) {
                case PSI_WARNING -> pw = value;
                case PSI_CRITICAL -> pc = value;
                case KL_WARNING -> kw = value;
                case KL_CRITICAL -> kc = value;
                case BIAS_TOLERANCE -> bt = value;
                case AUC_DROP_THRESHOLD -> ad = value;
                default -> extra.put(key, value);
            }
        }
        return new DriftThresholds(pw, pc, kw, kc, bt, ad, extra);
    }

    /**
     * Collect every threshold violation.
     *
     * @return list of human-readable errors, empty when valid
     */
    public List<String> violations() {
        List<String> errors = new ArrayList<>();
        requireFinite(errors, PSI_WARNING, psiWarning);
        requireFinite(errors, PSI_CRITICAL, psiCritical);
        requireFinite(errors, KL_WARNING, klWarning);
        requireFinite(errors, KL_CRITICAL, klCritical);
        requireFinite(errors, BIAS_TOLERANCE, biasTolerance);
        requireFinite(errors, AUC_DROP_THRESHOLD, aucDropThreshold);

        if (psiWarning >= psiCritical) {
            errors.add("'" + PSI_WARNING + "' (" + psiWarning + ") must be < '"
                    + PSI_CRITICAL + "' (" + psiCritical + ")");
        }
        if (klWarning >= klCritical) {
            errors.add("'" + KL_WARNING + "' (" + klWarning + ") must be < '"
                    + KL_CRITICAL + "' (" + klCritical + ")");
        }
        if (biasTolerance < 0) {
            errors.add("'" + BIAS_TOLERANCE + "' must be >= 0, got: " + biasTolerance);
        }
        if (aucDropThreshold < 0) {
            errors.add("'" + AUC_DROP_THRESHOLD + "' must be >= 0, got: " + aucDropThreshold);
        }
        return errors;
    }

    /**
     * @throws ConfigValidationException if any threshold is invalid
     */
    public void validate() {
        List<String> errors = violations();
        if (!errors.isEmpty()) {
            throw new ConfigValidationException("DriftThresholds", errors);
        }
    }

    private static void requireFinite(List<String> errors, String key, double value) {
        if (!Double.isFinite(value)) {
            errors.add("'" + key + "' must be a finite number, got: " + value);
        }
    }

    public double getPsiWarning() {
        return psiWarning;
    }

    public double getPsiCritical() {
        return psiCritical;
    }

    public double getKlWarning() {
        return klWarning;
    }

    public double getKlCritical() {
        return klCritical;
    }

    public double getBiasTolerance() {
        return biasTolerance;
    }

    public double getAucDropThreshold() {
        return aucDropThreshold;
    }

    /**
     * @return unmodifiable map of thresholds with no typed field
     */
    public Map<String, Double> getCustom() {
        return custom;
    }

    /**
     * @return every threshold as a flat key/value map
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(PSI_WARNING, psiWarning);
        map.put(PSI_CRITICAL, psiCritical);
        map.put(KL_WARNING, klWarning);
        map.put(KL_CRITICAL, klCritical);
        map.put(BIAS_TOLERANCE, biasTolerance);
        map.put(AUC_DROP_THRESHOLD, aucDropThreshold);
        map.putAll(custom);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftThresholds that))
            return false;
        return asMap().equals(that.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "DriftThresholds" + asMap();
    }
}
