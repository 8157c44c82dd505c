package com.alertengine.core.events;

import com.alertengine.core.model.AlertPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AlertNotified(
        Instant timestamp,
        String tenantId,
        String alertId,
        AlertPriority priority,
        Map<String, List<String>> channelsByUser
) implements Event {
    @Override
    public String type() {
        return "AlertNotified";
    }
}
