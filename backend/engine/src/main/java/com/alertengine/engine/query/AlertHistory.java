package com.alertengine.engine.query;

import com.alertengine.core.model.Alert;

import java.util.List;

public record AlertHistory(
        String tenantId,
        int days,
        int totalAlerts,
        List<Alert> alerts,
        InteractionStats interactionStats,
        AlertTrends trends,
        FatigueIndicators fatigue
) {
}
