package com.alertengine.core.events;

import com.alertengine.core.model.AlertStatus;

import java.time.Instant;

public record AlertStatusChanged(
        Instant timestamp,
        String tenantId,
        String alertId,
        AlertStatus previousStatus,
        AlertStatus newStatus,
        String userId,
        String reason
) implements Event {
    @Override
    public String type() {
        return "AlertStatusChanged";
    }
}
