package com.alertengine.engine.store;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.core.model.UserAlertPreferences;

import java.util.List;

/**
 * Point-in-time copy of every table, used to persist and restore a store.
 */
public record StoreSnapshot(
        List<Alert> alerts,
        List<AlertRule> rules,
        List<UserAlertPreferences> preferences,
        List<Interaction> interactions,
        List<TrainingSample> trainingSamples,
        List<AlertPattern> patterns
) {
    public StoreSnapshot {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        rules = rules == null ? List.of() : List.copyOf(rules);
        preferences = preferences == null ? List.of() : List.copyOf(preferences);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        trainingSamples = trainingSamples == null ? List.of() : List.copyOf(trainingSamples);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static StoreSnapshot empty() {
        return new StoreSnapshot(null, null, null, null, null, null);
    }
}
