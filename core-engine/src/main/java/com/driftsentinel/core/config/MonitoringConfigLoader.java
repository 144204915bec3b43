package com.driftsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates a {@link MonitoringConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_MODELS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the parsed registrations so that a
 * bad model entry stops startup instead of failing on its first check.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_MODELS_PATH = "DRIFT_MODELS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "models.yml";

    private MonitoringConfigLoader() {
        // utility class
    }

    /**
     * Load the registry using automatic resolution: {@value #ENV_MODELS_PATH}
     * if set and the file exists, otherwise {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return parsed and validated configuration
     * @throws ConfigValidationException if a model is invalid
     */
    public static MonitoringConfig load() {
        String envPath = System.getenv(ENV_MODELS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading model registry from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading model registry from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException  if the file does not exist
     * @throws IllegalStateException     if reading fails
     * @throws ConfigValidationException if a model is invalid
     */
    public static MonitoringConfig fromFile(String path) {
        Objects.requireNonNull(path, "Model registry path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Model registry file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model registry file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException  if the resource does not exist
     * @throws IllegalStateException     if reading fails
     * @throws ConfigValidationException if a model is invalid
     */
    public static MonitoringConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = MonitoringConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static MonitoringConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        options.setEnumCaseSensitive(false);
        Yaml yaml = new Yaml(new Constructor(MonitoringConfig.class, options));
        MonitoringConfig config = yaml.load(is);

        if (config == null || config.getModels().isEmpty()) {
            LOG.warn("No models defined in drift monitoring configuration");
            config = new MonitoringConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} model registration(s)", config.getModels().size());
        return config;
    }
}
