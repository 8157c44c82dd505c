package com.alertengine.engine.scoring;

import java.util.Map;

public interface FeedbackClassifier {
    /**
     * Probability in [0, 1] that users will find an alert with these features useful.
     */
    double predictUsefulness(Map<String, Double> features);

    int trainedOn();
}
