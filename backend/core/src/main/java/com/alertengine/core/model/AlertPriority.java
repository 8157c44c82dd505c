package com.alertengine.core.model;

import com.alertengine.core.error.InvalidPriorityFilterException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Priority bands derived from the composite score. Higher {@link #rank()} is more important.
 */
public enum AlertPriority {
    @JsonProperty("critical")
    CRITICAL("critical", 4, 0.8),
    @JsonProperty("high")
    HIGH("high", 3, 0.65),
    @JsonProperty("medium")
    MEDIUM("medium", 2, 0.4),
    @JsonProperty("low")
    LOW("low", 1, 0.2),
    @JsonProperty("info")
    INFO("info", 0, Double.NEGATIVE_INFINITY);

    private final String value;
    private final int rank;
    private final double minimumComposite;

    AlertPriority(String value, int rank, double minimumComposite) {
        this.value = value;
        this.rank = rank;
        this.minimumComposite = minimumComposite;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public double minimumComposite() {
        return minimumComposite;
    }

    public boolean isAtLeast(AlertPriority threshold) {
        return rank >= threshold.rank;
    }

    public static AlertPriority fromComposite(double compositeScore) {
        for (AlertPriority priority : values()) {
            if (compositeScore >= priority.minimumComposite) {
                return priority;
            }
        }
        return INFO;
    }

    @JsonCreator
    public static AlertPriority fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (AlertPriority priority : values()) {
                if (priority.value.equals(normalized)) {
                    return priority;
                }
            }
        }
        throw new InvalidPriorityFilterException(String.valueOf(raw),
                Arrays.stream(values()).map(AlertPriority::value).collect(Collectors.joining(", ")));
    }
}
