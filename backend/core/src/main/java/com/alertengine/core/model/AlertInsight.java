package com.alertengine.core.model;

import java.time.Instant;
import java.util.Map;

public record AlertInsight(
        String tenantId,
        Instant generatedAt,
        int activeAlerts,
        int createdLast24h,
        int suppressedLast24h,
        Map<AlertPriority, Integer> activeByPriority,
        Map<AlertCategory, Integer> activeByCategory,
        double acknowledgementRate,
        double averageResponseSeconds
) {
}
