package com.driftsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the model registry YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * models:
 *   - modelId: credit-risk
 *     modelVersion: "2.1.0"
 *     scheduleInterval: HOURLY
 *     thresholds:
 *       psi_critical: 0.3
 *     baselineData:
 *       age: [21, 34, 45, 52]
 * </pre>
 *
 * @since 1.0.0
 */
public class MonitoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<ModelDriftConfig> models = new ArrayList<>();

    /**
     * @return unmodifiable list of model registrations
     */
    public List<ModelDriftConfig> getModels() {
        return Collections.unmodifiableList(models);
    }

    /**
     * Set the model list (used by SnakeYAML during deserialization).
     *
     * @param models the model registrations
     */
    public void setModels(List<ModelDriftConfig> models) {
        this.models = models != null ? new ArrayList<>(models) : new ArrayList<>();
    }

    /**
     * Validate every registration and reject duplicate model ids.
     *
     * @throws ConfigValidationException listing the problems of every
     *                                   invalid model
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < models.size(); i++) {
            ModelDriftConfig model = Objects.requireNonNull(models.get(i),
                    "Model at index " + i + " is null");
            try {
                model.validate();
            } catch (ConfigValidationException e) {
                errors.addAll(e.getErrors());
            }
            if (model.getModelId() != null && !seen.add(model.getModelId())) {
                errors.add("Duplicate modelId '" + model.getModelId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigValidationException("monitoring configuration", errors);
        }
    }

    @Override
    public String toString() {
        return "MonitoringConfig{models=" + models + '}';
    }
}
