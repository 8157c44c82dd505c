package com.alertengine.engine.api;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.UserAlertPreferences;

import java.util.List;
import java.util.Map;

public interface NotificationGateway {
    /**
     * Delivers a freshly persisted alert. {@code recipients} are the tenant users whose preferences
     * admit the alert's category and priority; channel and quiet-hour choices belong to the gateway.
     *
     * @return the channels used per user id, empty when nobody was reached
     */
    Map<String, List<String>> notify(Alert alert, List<UserAlertPreferences> recipients);
}
