package com.alertengine.core.model;

import java.time.Instant;
import java.util.Map;

public record TrainingSample(
        String sampleId,
        String tenantId,
        String alertId,
        AlertCategory category,
        Map<String, Double> features,
        String userResponse,
        double feedbackScore,
        Instant createdAt
) {
    public TrainingSample {
        features = features == null ? Map.of() : Map.copyOf(features);
    }
}
