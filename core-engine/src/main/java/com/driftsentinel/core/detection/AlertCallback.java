package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.AlertDetails;

/**
 * Receives drift alerts for a model.
 *
 * <p>
 * Invoked synchronously on the thread that ran the check. Exceptions thrown
 * by an implementation are logged by the caller and never fail the check.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertCallback {

    /**
     * @param modelId model whose check raised the alert
     * @param details report id, overall status, recommendations and the ids
     *                of the safety events raised
     */
    void onAlert(String modelId, AlertDetails details);
}
