package com.alertengine.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A scored alert. {@code priority} and the score fields are fixed at creation; only the status
 * fields, {@code similarAlertCount}, {@code updatedAt} and the augmented {@code recommendedActions}
 * change afterwards.
 */
public record Alert(
        String alertId,
        String fingerprint,
        String tenantId,
        String ruleId,
        String title,
        String message,
        AlertCategory category,
        AlertPriority priority,
        double confidence,
        double severity,
        double urgency,
        double businessImpact,
        AlertStatus status,
        String statusReason,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt,
        Instant snoozedUntil,
        Map<String, Object> metadata,
        Map<String, Object> sourceData,
        List<String> recommendedActions,
        int similarAlertCount,
        Map<String, Double> mlFeatures
) {
    public Alert {
        Objects.requireNonNull(alertId, "alertId is required");
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(priority, "priority is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        metadata = metadata == null ? Map.of() : metadata;
        sourceData = sourceData == null ? Map.of() : sourceData;
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
        mlFeatures = mlFeatures == null ? Map.of() : mlFeatures;
    }

    public double compositeScore() {
        return (confidence + severity + urgency + businessImpact) / 4.0;
    }

    public Alert withStatus(AlertStatus next, String reason, Instant at) {
        return transition(next, reason, at, null);
    }

    public Alert withSnooze(Instant until, String reason, Instant at) {
        return transition(AlertStatus.SNOOZED, reason, at, until);
    }

    private Alert transition(AlertStatus next, String reason, Instant at, Instant nextSnoozedUntil) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Alert " + alertId + " is already " + status.value());
        }
        return new Alert(alertId, fingerprint, tenantId, ruleId, title, message, category, priority,
                confidence, severity, urgency, businessImpact, next, reason, createdAt, at, expiresAt,
                nextSnoozedUntil, metadata, sourceData, recommendedActions, similarAlertCount, mlFeatures);
    }

    public Alert withRecommendedActions(List<String> actions, Instant at) {
        return new Alert(alertId, fingerprint, tenantId, ruleId, title, message, category, priority,
                confidence, severity, urgency, businessImpact, status, statusReason, createdAt, at,
                expiresAt, snoozedUntil, metadata, sourceData, actions, similarAlertCount, mlFeatures);
    }

    public Alert withSimilarAlertRecorded(Instant at) {
        return new Alert(alertId, fingerprint, tenantId, ruleId, title, message, category, priority,
                confidence, severity, urgency, businessImpact, status, statusReason, createdAt, at,
                expiresAt, snoozedUntil, metadata, sourceData, recommendedActions, similarAlertCount + 1,
                mlFeatures);
    }
}
