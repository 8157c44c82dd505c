package com.alertengine.engine.scoring;

import com.alertengine.engine.features.FeatureNames;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores from the currently installed classifier. Contributes nothing until a model is installed.
 */
public final class LearnedScoringStrategy implements ScoringStrategy {
    private final AtomicReference<FeedbackClassifier> model = new AtomicReference<>();

    public void install(FeedbackClassifier classifier) {
        model.set(classifier);
    }

    public void uninstall() {
        model.set(null);
    }

    public boolean isModelLoaded() {
        return model.get() != null;
    }

    public int modelSampleCount() {
        FeedbackClassifier current = model.get();
        return current == null ? 0 : current.trainedOn();
    }

    @Override
    public Optional<ScoreVector> score(ScoringContext context) {
        FeedbackClassifier current = model.get();
        if (current == null) {
            return Optional.empty();
        }
        double p = ScoreVector.clamp(current.predictUsefulness(context.features()));
        double categoryUrgency = context.feature(FeatureNames.CATEGORY_URGENCY, ScoringTables.NEUTRAL_SCORE);
        double impact = (context.feature(FeatureNames.REVENUE_IMPACT, 0.0)
                + context.feature(FeatureNames.CUSTOMER_IMPACT, 0.0)) / 2.0;
        return Optional.of(new ScoreVector(Math.max(p, 1.0 - p), p, (p + categoryUrgency) / 2.0, impact).clamped());
    }
}
