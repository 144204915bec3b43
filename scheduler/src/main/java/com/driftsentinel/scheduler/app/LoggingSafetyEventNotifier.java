package com.driftsentinel.scheduler.app;

import com.driftsentinel.core.detection.SafetyEventNotifier;
import com.driftsentinel.core.model.SafetyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default safety-event sink: logs every notified event as JSON at ERROR.
 */
public class LoggingSafetyEventNotifier implements SafetyEventNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingSafetyEventNotifier.class);

    @Override
    public void onSafetyEvent(SafetyEvent event) {
        LOG.error("Safety event {} for model [{}]{}: {}",
                event.getEventType(), event.getModelId(),
                event.isAutoPaused() ? " (model auto-paused)" : "",
                JsonSupport.toJson(event));
    }
}
