package com.alertengine.core.events;

import java.time.Instant;

public record PatternDetected(
        Instant timestamp,
        String tenantId,
        String patternId,
        int alertCount,
        double significanceScore
) implements Event {
    @Override
    public String type() {
        return "PatternDetected";
    }
}
