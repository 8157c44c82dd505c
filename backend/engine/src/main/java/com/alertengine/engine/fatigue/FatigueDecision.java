package com.alertengine.engine.fatigue;

/**
 * {@code alertsInWindow} counts the tenant's alerts of the category created before this one.
 */
public record FatigueDecision(boolean suppressed, int alertsInWindow, int dailyCap) {
    public String reason() {
        return "auto-suppressed: frequency limit (" + dailyCap + " per 24h)";
    }
}
