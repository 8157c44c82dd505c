package com.alertengine.core.model;

import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;

public record UserAlertPreferences(
        String userId,
        String tenantId,
        boolean emailEnabled,
        boolean smsEnabled,
        boolean pushEnabled,
        AlertPriority priorityThreshold,
        LocalTime quietHoursStart,
        LocalTime quietHoursEnd,
        Map<AlertCategory, Boolean> categoryEnabled,
        Map<AlertCategory, Integer> frequencyLimits,
        boolean adaptiveLearningEnabled,
        Instant updatedAt
) {
    public UserAlertPreferences {
        priorityThreshold = priorityThreshold == null ? AlertPriority.MEDIUM : priorityThreshold;
        categoryEnabled = categoryEnabled == null ? Map.of() : categoryEnabled;
        frequencyLimits = frequencyLimits == null ? Map.of() : frequencyLimits;
    }

    public static UserAlertPreferences defaults(String userId, String tenantId, Instant now) {
        Map<AlertCategory, Boolean> enabled = new EnumMap<>(AlertCategory.class);
        for (AlertCategory category : AlertCategory.values()) {
            enabled.put(category, category != AlertCategory.OPPORTUNITY);
        }
        Map<AlertCategory, Integer> limits = new EnumMap<>(AlertCategory.class);
        limits.put(AlertCategory.BUSINESS_METRIC, 10);
        limits.put(AlertCategory.SYSTEM_HEALTH, 5);
        limits.put(AlertCategory.CUSTOMER_BEHAVIOR, 8);
        limits.put(AlertCategory.REVENUE_ANOMALY, 3);
        limits.put(AlertCategory.OPERATIONAL_ISSUE, 6);
        limits.put(AlertCategory.OPPORTUNITY, 2);
        limits.put(AlertCategory.COMPLIANCE, 3);
        limits.put(AlertCategory.SECURITY, 2);
        return new UserAlertPreferences(
                userId,
                tenantId,
                true,
                false,
                true,
                AlertPriority.MEDIUM,
                LocalTime.of(22, 0),
                LocalTime.of(8, 0),
                enabled,
                limits,
                true,
                now
        );
    }

    public boolean isCategoryEnabled(AlertCategory category) {
        return categoryEnabled.getOrDefault(category, true);
    }

    /**
     * Quiet hours may wrap midnight (22:00 to 08:00).
     */
    public boolean isQuietAt(LocalTime time) {
        if (quietHoursStart == null || quietHoursEnd == null || quietHoursStart.equals(quietHoursEnd)) {
            return false;
        }
        if (quietHoursStart.isBefore(quietHoursEnd)) {
            return !time.isBefore(quietHoursStart) && time.isBefore(quietHoursEnd);
        }
        return !time.isBefore(quietHoursStart) || time.isBefore(quietHoursEnd);
    }
}
