package com.alertengine.engine;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record EngineHealth(
        String status,
        boolean learnedModelLoaded,
        int learnedModelSamples,
        boolean backgroundProcessorRunning,
        Instant lastTickAt,
        List<String> lastTickFailedSteps,
        Map<String, Long> counters
) {
}
