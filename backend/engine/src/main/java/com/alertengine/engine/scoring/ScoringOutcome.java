package com.alertengine.engine.scoring;

import com.alertengine.core.model.AlertPriority;

public record ScoringOutcome(ScoreVector scores, double feedbackFactor, AlertPriority priority) {
}
