package com.alertengine.engine.lifecycle;

import java.util.List;
import java.util.Locale;

/**
 * Usefulness scores in [0, 1] attached to training samples for each kind of user response.
 */
public final class FeedbackScores {
    public static final double ACKNOWLEDGED = 0.7;
    public static final double RESOLVED = 0.9;
    public static final double DISMISSED_USEFUL = 0.6;
    public static final double DISMISSED_NOISE = 0.1;
    public static final double DISMISSED_DEFAULT = 0.2;
    public static final int MAX_RATING = 5;

    private static final List<String> NOISE_MARKERS =
            List.of("spam", "noise", "noisy", "irrelevant", "not useful", "useless");

    private FeedbackScores() {
    }

    /**
     * Noise markers win over "useful" so that "not useful" reads as noise.
     */
    public static double forDismissal(String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return DISMISSED_DEFAULT;
        }
        String text = feedback.toLowerCase(Locale.ROOT);
        for (String marker : NOISE_MARKERS) {
            if (text.contains(marker)) {
                return DISMISSED_NOISE;
            }
        }
        if (text.contains("useful") || text.contains("helpful")) {
            return DISMISSED_USEFUL;
        }
        return DISMISSED_DEFAULT;
    }

    public static double forRating(int rating) {
        if (rating < 1 || rating > MAX_RATING) {
            throw new IllegalArgumentException("rating must be between 1 and " + MAX_RATING + ", got " + rating);
        }
        return rating / (double) MAX_RATING;
    }
}
