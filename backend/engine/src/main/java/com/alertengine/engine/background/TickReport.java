package com.alertengine.engine.background;

import java.time.Instant;
import java.util.List;

public record TickReport(Instant startedAt, long durationMillis, List<StepResult> steps) {
    public TickReport {
        steps = List.copyOf(steps);
    }

    public boolean success() {
        return steps.stream().allMatch(StepResult::success);
    }

    public List<String> failedSteps() {
        return steps.stream().filter(step -> !step.success()).map(StepResult::step).toList();
    }
}
