package com.alertengine.engine.background;

import java.time.Instant;

public interface ProcessorStep {
    String name();

    StepResult run(Instant now);
}
