package com.driftsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Payload handed to a model's alert callback when a check finishes with a
 * non-{@link AlertLevel#NORMAL} status.
 *
 * @since 1.0.0
 */
public final class AlertDetails implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final String reportId;
    private final AlertLevel overallStatus;
    private final List<String> recommendations;
    private final List<UUID> safetyEventIds;

    public AlertDetails(String modelId, String reportId, AlertLevel overallStatus,
            List<String> recommendations, List<UUID> safetyEventIds) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.reportId = Objects.requireNonNull(reportId, "reportId must not be null");
        this.overallStatus = Objects.requireNonNull(overallStatus, "overallStatus must not be null");
        this.recommendations = List.copyOf(recommendations);
        this.safetyEventIds = List.copyOf(safetyEventIds);
    }

    /**
     * @param report the report that produced the alert
     * @return details extracted from {@code report}
     */
    public static AlertDetails from(DriftReport report) {
        return new AlertDetails(
                report.getModelId(),
                report.getReportId(),
                report.getOverallStatus(),
                report.getRecommendations(),
                report.getSafetyEvents().stream().map(SafetyEvent::getEventId).toList());
    }

    public String getModelId() {
        return modelId;
    }

    public String getReportId() {
        return reportId;
    }

    public AlertLevel getOverallStatus() {
        return overallStatus;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public List<UUID> getSafetyEventIds() {
        return safetyEventIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertDetails that))
            return false;
        return modelId.equals(that.modelId) && reportId.equals(that.reportId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, reportId);
    }

    @Override
    public String toString() {
        return "AlertDetails{" +
                "modelId='" + modelId + '\'' +
                ", reportId='" + reportId + '\'' +
                ", overallStatus=" + overallStatus +
                ", safetyEventIds=" + safetyEventIds +
                '}';
    }
}
