package com.alertengine.core.events;

import java.time.Instant;

public record AlertDeduplicated(
        Instant timestamp,
        String tenantId,
        String alertId,
        int similarAlertCount
) implements Event {
    @Override
    public String type() {
        return "AlertDeduplicated";
    }
}
