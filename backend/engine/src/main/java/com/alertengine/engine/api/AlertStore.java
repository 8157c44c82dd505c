package com.alertengine.engine.api;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.core.model.UserAlertPreferences;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Durable storage for the engine's six logical tables. Implementations throw
 * {@link com.alertengine.core.error.StorageFailureException} when the backing storage is unreachable.
 */
public interface AlertStore {
    void saveAlert(Alert alert);

    Optional<Alert> findAlert(String alertId);

    /**
     * Applies {@code update} atomically with respect to other updates of the same alert. Returning
     * the argument unchanged skips the write.
     */
    Optional<Alert> updateAlert(String alertId, UnaryOperator<Alert> update);

    Optional<Alert> latestByFingerprint(String tenantId, String fingerprint);

    List<Alert> alertsCreatedSince(String tenantId, Instant since);

    List<Alert> alertsForTenant(String tenantId, AlertStatus status);

    List<Alert> alertsWithStatus(AlertStatus status);

    int deleteAlerts(Collection<String> alertIds);

    Set<String> tenantIds();

    Optional<AlertRule> findRule(String ruleId);

    List<AlertRule> rulesForTenant(String tenantId);

    void saveRule(AlertRule rule);

    Optional<AlertRule> updateRule(String ruleId, UnaryOperator<AlertRule> update);

    Optional<UserAlertPreferences> findPreferences(String userId, String tenantId);

    List<UserAlertPreferences> preferencesForTenant(String tenantId);

    void savePreferences(UserAlertPreferences preferences);

    void appendInteraction(Interaction interaction);

    List<Interaction> interactionsForAlert(String alertId);

    List<Interaction> interactionsSince(String tenantId, Instant since);

    void appendTrainingSample(TrainingSample sample);

    List<TrainingSample> trainingSamplesSince(Instant since);

    int pruneTrainingSamples(Instant before);

    void savePattern(AlertPattern pattern);

    List<AlertPattern> patternsForTenant(String tenantId);
}
