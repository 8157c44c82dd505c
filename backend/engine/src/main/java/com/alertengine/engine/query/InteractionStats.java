package com.alertengine.engine.query;

import com.alertengine.core.model.InteractionType;

import java.util.Map;

public record InteractionStats(
        int totalInteractions,
        int userInteractions,
        Map<InteractionType, Integer> countsByType,
        Map<InteractionType, Double> averageResponseSecondsByType
) {
}
