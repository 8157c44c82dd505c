package com.alertengine.engine.scoring;

public record ScoreVector(double confidence, double severity, double urgency, double businessImpact) {
    public static final ScoreVector NEUTRAL = new ScoreVector(0.5, 0.5, 0.5, 0.5);

    public double composite() {
        return (confidence + severity + urgency + businessImpact) / 4.0;
    }

    public ScoreVector scaled(double factor) {
        return new ScoreVector(confidence * factor, severity * factor, urgency * factor, businessImpact * factor);
    }

    public ScoreVector clamped() {
        return new ScoreVector(clamp(confidence), clamp(severity), clamp(urgency), clamp(businessImpact));
    }

    /**
     * Per-dimension {@code weights * this + (1 - weights) * other}.
     */
    public ScoreVector blend(ScoreVector other, ScoreVector weights) {
        return new ScoreVector(
                mix(confidence, other.confidence, weights.confidence),
                mix(severity, other.severity, weights.severity),
                mix(urgency, other.urgency, weights.urgency),
                mix(businessImpact, other.businessImpact, weights.businessImpact)
        );
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double mix(double own, double other, double weight) {
        return weight * own + (1.0 - weight) * other;
    }
}
