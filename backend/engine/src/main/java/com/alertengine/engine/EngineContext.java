package com.alertengine.engine;

import com.alertengine.core.bus.EventBus;
import com.alertengine.engine.api.ActionAugmenter;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.api.NotificationGateway;
import com.alertengine.engine.config.EngineSettings;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators of {@link AlertEngine}. {@code actionAugmenter} may be null.
 */
public record EngineContext(
        AlertStore store,
        NotificationGateway notificationGateway,
        EventBus eventBus,
        Clock clock,
        EngineSettings settings,
        ActionAugmenter actionAugmenter
) {
    public EngineContext {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(notificationGateway, "notificationGateway is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
