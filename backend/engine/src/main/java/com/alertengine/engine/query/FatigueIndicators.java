package com.alertengine.engine.query;

public record FatigueIndicators(
        double alertsPerDay,
        int autoSuppressed,
        double dismissalRate,
        double averageRepeatCount,
        String fatigueRisk
) {
}
