package com.alertengine.engine.scoring;

import com.alertengine.core.model.AlertPriority;

/**
 * Final scoring step: blended scores, then the feedback factor, then clamping. Priority is a pure
 * function of the resulting vector.
 */
public final class AlertScorer {
    private final ScoringStrategy strategy;
    private final FeedbackAdjuster adjuster;

    public AlertScorer(ScoringStrategy strategy, FeedbackAdjuster adjuster) {
        this.strategy = strategy;
        this.adjuster = adjuster;
    }

    public ScoringOutcome score(ScoringContext context) {
        ScoreVector blended = strategy.score(context).orElse(ScoreVector.NEUTRAL);
        double factor = adjuster.factorFor(context.tenantId(), context.category());
        ScoreVector adjusted = blended.scaled(factor).clamped();
        return new ScoringOutcome(adjusted, factor, AlertPriority.fromComposite(adjusted.composite()));
    }
}
