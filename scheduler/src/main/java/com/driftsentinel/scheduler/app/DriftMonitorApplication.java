package com.driftsentinel.scheduler.app;

import com.driftsentinel.core.config.ModelDriftConfig;
import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.config.MonitoringConfigLoader;
import com.driftsentinel.scheduler.DriftScheduler;
import com.driftsentinel.scheduler.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Service entry point.
 *
 * <pre>
 *   SchedulerConfig (env)
 *     → MonitoringConfigLoader (YAML model registry)
 *     → DriftScheduler (logging alert and safety-event sinks)
 *     → start, then block until JVM shutdown
 * </pre>
 *
 * @since 1.0.0
 */
public final class DriftMonitorApplication {

    private static final Logger LOG = LoggerFactory.getLogger(DriftMonitorApplication.class);

    private DriftMonitorApplication() {
    }

    public static void main(String[] args) throws InterruptedException {
        SchedulerConfig config = SchedulerConfig.fromEnvironment();
        LOG.info("Starting Drift Sentinel with config: {}", config);

        MonitoringConfig models = loadModels(config);
        if (models.getModels().isEmpty()) {
            throw new IllegalStateException(
                    "No models defined. Provide a registry via "
                            + MonitoringConfigLoader.ENV_MODELS_PATH
                            + " or a classpath " + MonitoringConfigLoader.DEFAULT_RESOURCE + " file.");
        }

        DriftScheduler scheduler = createScheduler(config, models);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            stopped.countDown();
        }, "drift-scheduler-shutdown"));

        scheduler.start();
        stopped.await();
    }

    static DriftScheduler createScheduler(SchedulerConfig config, MonitoringConfig models) {
        DriftScheduler scheduler = DriftScheduler.builder()
                .settings(config)
                .safetyNotifier(new LoggingSafetyEventNotifier())
                .build();
        LoggingAlertSink alertSink = new LoggingAlertSink();
        for (ModelDriftConfig model : models.getModels()) {
            if (model.getAlertCallback() == null) {
                model.setAlertCallback(alertSink);
            }
            scheduler.configureModel(model);
        }
        return scheduler;
    }

    private static MonitoringConfig loadModels(SchedulerConfig config) {
        String path = config.getModelsConfigPath();
        if (path != null && !path.isBlank()) {
            return MonitoringConfigLoader.fromFile(path);
        }
        return MonitoringConfigLoader.load();
    }
}
