package com.alertengine.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AlertPattern(
        String patternId,
        String tenantId,
        String patternType,
        Map<String, Double> centroid,
        List<String> alertIds,
        double significanceScore,
        Instant identifiedAt
) {
    public static final String CLUSTER = "cluster";

    public AlertPattern {
        centroid = centroid == null ? Map.of() : Map.copyOf(centroid);
        alertIds = alertIds == null ? List.of() : List.copyOf(alertIds);
    }
}
