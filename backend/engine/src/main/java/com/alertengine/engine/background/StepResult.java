package com.alertengine.engine.background;

import java.util.Map;

public record StepResult(String step, boolean success, String message, Map<String, Object> stats) {
    public StepResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static StepResult success(String step, String message, Map<String, Object> stats) {
        return new StepResult(step, true, message, stats);
    }

    public static StepResult failure(String step, String message) {
        return new StepResult(step, false, message, Map.of());
    }
}
