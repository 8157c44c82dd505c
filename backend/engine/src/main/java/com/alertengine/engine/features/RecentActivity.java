package com.alertengine.engine.features;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;

import java.util.Collection;

/**
 * Counts over a tenant's alerts from the trailing window, used as contextual features.
 */
public record RecentActivity(int similarAlerts, int categoryAlerts) {
    public static final RecentActivity NONE = new RecentActivity(0, 0);

    public static RecentActivity from(Collection<Alert> recentAlerts, String title, AlertCategory category) {
        int similar = 0;
        int sameCategory = 0;
        for (Alert alert : recentAlerts) {
            if (title != null && title.equalsIgnoreCase(alert.title())) {
                similar++;
            }
            if (alert.category() == category) {
                sameCategory++;
            }
        }
        return new RecentActivity(similar, sameCategory);
    }
}
