package com.alertengine.service.notify;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.engine.api.NotificationGateway;

import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes each delivery to the log instead of calling an email, SMS or push provider. Quiet hours
 * hold back everything except critical alerts.
 */
public class LoggingNotificationGateway implements NotificationGateway {
    private static final Logger LOGGER = Logger.getLogger(LoggingNotificationGateway.class.getName());

    public static final String EMAIL = "email";
    public static final String SMS = "sms";
    public static final String PUSH = "push";

    private final Clock clock;

    public LoggingNotificationGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<String, List<String>> notify(Alert alert, List<UserAlertPreferences> recipients) {
        LocalTime localNow = LocalTime.now(clock);
        Map<String, List<String>> delivered = new LinkedHashMap<>();
        for (UserAlertPreferences prefs : recipients) {
            if (alert.priority() != AlertPriority.CRITICAL && prefs.isQuietAt(localNow)) {
                LOGGER.fine("Quiet hours for user=" + prefs.userId() + "; holding alert " + alert.alertId());
                continue;
            }
            List<String> channels = channelsFor(prefs);
            if (channels.isEmpty()) {
                continue;
            }
            for (String channel : channels) {
                LOGGER.info("Notify channel=" + channel + " user=" + prefs.userId() + " tenant=" + alert.tenantId()
                        + " alert=" + alert.alertId() + " priority=" + alert.priority().value()
                        + " title=\"" + alert.title() + "\"");
            }
            delivered.put(prefs.userId(), channels);
        }
        return delivered;
    }

    static List<String> channelsFor(UserAlertPreferences prefs) {
        List<String> channels = new ArrayList<>();
        if (prefs.emailEnabled()) {
            channels.add(EMAIL);
        }
        if (prefs.smsEnabled()) {
            channels.add(SMS);
        }
        if (prefs.pushEnabled()) {
            channels.add(PUSH);
        }
        return List.copyOf(channels);
    }
}
