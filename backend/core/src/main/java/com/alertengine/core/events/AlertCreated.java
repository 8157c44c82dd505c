package com.alertengine.core.events;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;

import java.time.Instant;

public record AlertCreated(
        Instant timestamp,
        String tenantId,
        String alertId,
        AlertCategory category,
        AlertPriority priority,
        double compositeScore
) implements Event {
    @Override
    public String type() {
        return "AlertCreated";
    }
}
