package com.alertengine.engine.scoring;

import com.alertengine.core.model.AlertCategory;

import java.util.Map;

public record ScoringContext(
        String tenantId,
        AlertCategory category,
        Map<String, Double> features,
        int sourceFieldCount
) {
    public ScoringContext {
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    public double feature(String name, double fallback) {
        Double value = features.get(name);
        return value == null ? fallback : value;
    }
}
