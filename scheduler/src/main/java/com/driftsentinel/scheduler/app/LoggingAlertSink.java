package com.driftsentinel.scheduler.app;

import com.driftsentinel.core.detection.AlertCallback;
import com.driftsentinel.core.model.AlertDetails;
import com.driftsentinel.core.model.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert sink: logs the alert details as JSON, at ERROR for
 * CRITICAL reports and WARN otherwise.
 */
public class LoggingAlertSink implements AlertCallback {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void onAlert(String modelId, AlertDetails details) {
        String json = JsonSupport.toJson(details);
        if (details.getOverallStatus() == AlertLevel.CRITICAL) {
            LOG.error("Drift alert for model [{}]: {}", modelId, json);
        } else {
            LOG.warn("Drift alert for model [{}]: {}", modelId, json);
        }
    }
}
