package com.alertengine.engine.background;

import com.alertengine.core.model.TrainingSample;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.scoring.FeedbackAdjuster;
import com.alertengine.engine.scoring.LearnedScoringStrategy;
import com.alertengine.engine.scoring.LogisticFeedbackClassifier;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Retrains the feedback classifier whenever the retained sample set differs from the one it was
 * trained on, prunes samples past retention and recomputes the per-tenant feedback factors. When
 * retention leaves fewer than the minimum samples, the classifier is uninstalled and scoring falls
 * back to rules alone.
 */
public final class ModelRefresher implements ProcessorStep {
    private static final Logger LOGGER = Logger.getLogger(ModelRefresher.class.getName());

    private final AlertStore store;
    private final LearnedScoringStrategy learned;
    private final FeedbackAdjuster adjuster;
    private final Duration retention;
    private final int minSamples;
    private List<String> trainedSampleIds = List.of();

    public ModelRefresher(
            AlertStore store,
            LearnedScoringStrategy learned,
            FeedbackAdjuster adjuster,
            Duration retention,
            int minSamples
    ) {
        this.store = store;
        this.learned = learned;
        this.adjuster = adjuster;
        this.retention = retention;
        this.minSamples = minSamples;
    }

    @Override
    public String name() {
        return "model-refresh";
    }

    @Override
    public StepResult run(Instant now) {
        Instant cutoff = now.minus(retention);
        int pruned = store.pruneTrainingSamples(cutoff);
        List<TrainingSample> samples = store.trainingSamplesSince(cutoff);

        boolean retrained = false;
        boolean uninstalled = false;
        List<String> sampleIds = samples.stream().map(TrainingSample::sampleId).toList();
        if (samples.size() < minSamples) {
            if (learned.isModelLoaded()) {
                learned.uninstall();
                uninstalled = true;
                LOGGER.info("Feedback classifier uninstalled; " + samples.size() + " samples left after retention");
            }
            trainedSampleIds = List.of();
        } else if (!sampleIds.equals(trainedSampleIds)) {
            learned.install(LogisticFeedbackClassifier.train(samples));
            trainedSampleIds = sampleIds;
            retrained = true;
            LOGGER.info("Feedback classifier retrained on " + samples.size() + " samples");
        }

        int tenants = 0;
        for (String tenantId : store.tenantIds()) {
            adjuster.refresh(tenantId);
            tenants++;
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("samples", samples.size());
        stats.put("pruned", pruned);
        stats.put("retrained", retrained);
        stats.put("uninstalled", uninstalled);
        stats.put("tenants", tenants);
        String message = retrained ? "model retrained" : uninstalled ? "model uninstalled" : "model unchanged";
        return StepResult.success(name(), message, stats);
    }
}
