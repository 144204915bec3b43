package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.SafetyEvent;

/**
 * Sink for {@link com.driftsentinel.core.model.SafetySeverity#ERROR ERROR}
 * and {@link com.driftsentinel.core.model.SafetySeverity#CRITICAL CRITICAL}
 * safety events, typically wired to paging or ticketing.
 *
 * <p>
 * Called synchronously before the event is returned to the detector's
 * caller. A failing notifier does not prevent the event from being created.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SafetyEventNotifier {

    void onSafetyEvent(SafetyEvent event);
}
