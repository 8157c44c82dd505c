package com.alertengine.engine.config;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for the alert engine. Any null or non-positive value read from configuration falls
 * back to its default.
 */
public record EngineSettings(
        Duration dedupWindow,
        Duration fatigueWindow,
        Duration tickInterval,
        Duration criticalExpiry,
        Duration defaultExpiry,
        Duration alertRetention,
        Duration trainingRetention,
        Duration feedbackLookback,
        int minTrainingSamples,
        int minFeedbackInteractions,
        double clusterRadius,
        int clusterMinSize,
        Map<AlertCategory, Integer> defaultDailyCaps,
        int defaultListLimit,
        int maxListLimit,
        int maxHistoryDays
) {
    public EngineSettings {
        dedupWindow = positiveOr(dedupWindow, Duration.ofHours(24));
        fatigueWindow = positiveOr(fatigueWindow, Duration.ofHours(24));
        tickInterval = positiveOr(tickInterval, Duration.ofSeconds(30));
        criticalExpiry = positiveOr(criticalExpiry, Duration.ofHours(72));
        defaultExpiry = positiveOr(defaultExpiry, Duration.ofHours(24));
        alertRetention = positiveOr(alertRetention, Duration.ofDays(30));
        trainingRetention = positiveOr(trainingRetention, Duration.ofDays(90));
        feedbackLookback = positiveOr(feedbackLookback, Duration.ofDays(30));
        minTrainingSamples = minTrainingSamples > 0 ? minTrainingSamples : 10;
        minFeedbackInteractions = minFeedbackInteractions > 0 ? minFeedbackInteractions : 5;
        clusterRadius = clusterRadius > 0 ? clusterRadius : 0.3;
        clusterMinSize = clusterMinSize > 0 ? clusterMinSize : 2;
        defaultDailyCaps = mergedCaps(defaultDailyCaps);
        defaultListLimit = defaultListLimit > 0 ? defaultListLimit : 50;
        maxListLimit = maxListLimit > 0 ? maxListLimit : 200;
        maxHistoryDays = maxHistoryDays > 0 ? maxHistoryDays : 90;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, null, null, null, null, null, null,
                0, 0, 0, 0, null, 0, 0, 0);
    }

    public Duration expiryFor(AlertPriority priority) {
        return priority == AlertPriority.CRITICAL ? criticalExpiry : defaultExpiry;
    }

    public int defaultDailyCap(AlertCategory category) {
        return defaultDailyCaps.get(category);
    }

    public EngineSettings withDailyCap(AlertCategory category, int cap) {
        Map<AlertCategory, Integer> caps = new EnumMap<>(defaultDailyCaps);
        caps.put(category, cap);
        return new EngineSettings(dedupWindow, fatigueWindow, tickInterval, criticalExpiry, defaultExpiry,
                alertRetention, trainingRetention, feedbackLookback, minTrainingSamples, minFeedbackInteractions,
                clusterRadius, clusterMinSize, caps, defaultListLimit, maxListLimit, maxHistoryDays);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }

    private static Map<AlertCategory, Integer> mergedCaps(Map<AlertCategory, Integer> configured) {
        Map<AlertCategory, Integer> caps = new EnumMap<>(AlertCategory.class);
        caps.put(AlertCategory.BUSINESS_METRIC, 10);
        caps.put(AlertCategory.SYSTEM_HEALTH, 5);
        caps.put(AlertCategory.CUSTOMER_BEHAVIOR, 8);
        caps.put(AlertCategory.REVENUE_ANOMALY, 3);
        caps.put(AlertCategory.OPERATIONAL_ISSUE, 6);
        caps.put(AlertCategory.OPPORTUNITY, 2);
        caps.put(AlertCategory.COMPLIANCE, 3);
        caps.put(AlertCategory.SECURITY, 2);
        if (configured != null) {
            configured.forEach((category, cap) -> {
                if (category != null && cap != null && cap > 0) {
                    caps.put(category, cap);
                }
            });
        }
        return Map.copyOf(caps);
    }
}
