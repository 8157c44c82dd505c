package com.alertengine.engine.scoring;

import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Blends the rule-based and learned results with the fixed per-dimension weights. When the learned
 * strategy has no result, or fails, the rule-based result is used alone.
 */
public final class BlendedScoringStrategy implements ScoringStrategy {
    private static final Logger LOGGER = Logger.getLogger(BlendedScoringStrategy.class.getName());

    private final ScoringStrategy ruleBased;
    private final ScoringStrategy learned;
    private final LongAdder degradations = new LongAdder();

    public BlendedScoringStrategy(ScoringStrategy ruleBased, ScoringStrategy learned) {
        this.ruleBased = ruleBased;
        this.learned = learned;
    }

    @Override
    public Optional<ScoreVector> score(ScoringContext context) {
        ScoreVector rule = ruleBased.score(context).orElse(ScoreVector.NEUTRAL);
        Optional<ScoreVector> model = Optional.empty();
        try {
            model = learned.score(context);
        } catch (RuntimeException e) {
            degradations.increment();
            LOGGER.log(Level.WARNING, "ScoringDegraded tenant=" + context.tenantId()
                    + " category=" + context.category().value() + "; using rule-based scores", e);
        }
        return Optional.of(model.map(m -> rule.blend(m, ScoringTables.ruleWeights())).orElse(rule));
    }

    public long degradations() {
        return degradations.sum();
    }
}
