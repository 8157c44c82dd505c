package com.alertengine.core.events;

import java.time.Instant;
import java.util.List;

public record ProcessorTickCompleted(
        Instant timestamp,
        boolean success,
        long durationMillis,
        List<String> failedSteps
) implements Event {
    @Override
    public String type() {
        return "ProcessorTickCompleted";
    }
}
