package com.alertengine.engine.lifecycle;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.Interaction;

import java.util.Optional;

/**
 * Outcome of a user action. {@code changed} is false when the action was an idempotent no-op,
 * in which case no interaction was recorded.
 */
public record LifecycleResult(Alert alert, boolean changed, Optional<Interaction> interaction) {
    public static LifecycleResult unchanged(Alert alert) {
        return new LifecycleResult(alert, false, Optional.empty());
    }

    public static LifecycleResult changed(Alert alert, Interaction interaction) {
        return new LifecycleResult(alert, true, Optional.ofNullable(interaction));
    }
}
