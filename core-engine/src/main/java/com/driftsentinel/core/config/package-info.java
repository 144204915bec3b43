/**
 * Model registration and threshold configuration.
 *
 * <p>
 * Registrations are plain {@link com.driftsentinel.core.config.ModelDriftConfig}
 * beans, built in code or loaded from YAML by
 * {@link com.driftsentinel.core.config.MonitoringConfigLoader}. Validation
 * collects every problem and reports them together in a
 * {@link com.driftsentinel.core.config.ConfigValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
