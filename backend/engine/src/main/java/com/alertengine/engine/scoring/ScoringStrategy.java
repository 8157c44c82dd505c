package com.alertengine.engine.scoring;

import java.util.Optional;

public interface ScoringStrategy {
    /**
     * Scores one alert. An empty result means the strategy has nothing to contribute (for example
     * an untrained model); it never means the alert is unimportant.
     */
    Optional<ScoreVector> score(ScoringContext context);
}
