package com.alertengine.engine.features;

import java.util.Locale;
import java.util.Optional;

public enum Trend {
    INCREASING(1.0),
    STABLE(0.5),
    DECREASING(0.0);

    private final double featureValue;

    Trend(double featureValue) {
        this.featureValue = featureValue;
    }

    /**
     * Encoded into [0, 1] as increasing = 1.0, stable = 0.5, decreasing = 0.0.
     */
    public double featureValue() {
        return featureValue;
    }

    public static Optional<Trend> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "increasing":
            case "up":
                return Optional.of(INCREASING);
            case "decreasing":
            case "down":
                return Optional.of(DECREASING);
            case "stable":
            case "flat":
                return Optional.of(STABLE);
            default:
                return Optional.empty();
        }
    }
}
