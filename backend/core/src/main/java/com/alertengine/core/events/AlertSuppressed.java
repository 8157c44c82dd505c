package com.alertengine.core.events;

import com.alertengine.core.model.AlertCategory;

import java.time.Instant;

public record AlertSuppressed(
        Instant timestamp,
        String tenantId,
        String alertId,
        AlertCategory category,
        int alertsInWindow,
        int dailyCap,
        String reason
) implements Event {
    @Override
    public String type() {
        return "AlertSuppressed";
    }
}
