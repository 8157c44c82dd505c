package com.alertengine.core.events;

import com.alertengine.core.model.AlertInsight;

import java.time.Instant;

public record InsightGenerated(
        Instant timestamp,
        AlertInsight insight
) implements Event {
    @Override
    public String type() {
        return "InsightGenerated";
    }
}
