package com.alertengine.service.notify;

import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.UserAlertPreferences;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.alertengine.service.support.ServiceFixtures.T0;
import static com.alertengine.service.support.ServiceFixtures.TENANT;
import static com.alertengine.service.support.ServiceFixtures.alert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingNotificationGatewayTest {
    @Test
    void deliversOnEnabledChannels() {
        LoggingNotificationGateway gateway = new LoggingNotificationGateway(Clock.fixed(T0, ZoneOffset.UTC));
        UserAlertPreferences defaults = UserAlertPreferences.defaults("barber-1", TENANT, T0);
        UserAlertPreferences smsOnly = withChannels("barber-2", false, true, false, null, null);

        Map<String, List<String>> delivered = gateway.notify(alert("a1", AlertPriority.HIGH), List.of(defaults, smsOnly));

        assertEquals(List.of("email", "push"), delivered.get("barber-1"));
        assertEquals(List.of("sms"), delivered.get("barber-2"));
    }

    @Test
    void quietHoursHoldBackAllButCritical() {
        Instant lateEvening = Instant.parse("2026-03-10T23:15:00Z");
        LoggingNotificationGateway gateway = new LoggingNotificationGateway(Clock.fixed(lateEvening, ZoneOffset.UTC));
        UserAlertPreferences sleeper = withChannels("barber-1", true, false, true, LocalTime.of(22, 0),
                LocalTime.of(8, 0));

        assertTrue(gateway.notify(alert("a1", AlertPriority.HIGH), List.of(sleeper)).isEmpty());
        assertEquals(List.of("email", "push"),
                gateway.notify(alert("a2", AlertPriority.CRITICAL), List.of(sleeper)).get("barber-1"));
    }

    @Test
    void userWithNoChannelsIsNotReached() {
        LoggingNotificationGateway gateway = new LoggingNotificationGateway(Clock.fixed(T0, ZoneOffset.UTC));

        assertTrue(gateway.notify(alert("a1", AlertPriority.CRITICAL),
                List.of(withChannels("barber-1", false, false, false, null, null))).isEmpty());
    }

    private static UserAlertPreferences withChannels(String userId, boolean email, boolean sms, boolean push,
                                                     LocalTime quietStart, LocalTime quietEnd) {
        UserAlertPreferences base = UserAlertPreferences.defaults(userId, TENANT, T0);
        return new UserAlertPreferences(userId, TENANT, email, sms, push, base.priorityThreshold(), quietStart,
                quietEnd, base.categoryEnabled(), base.frequencyLimits(), base.adaptiveLearningEnabled(), T0);
    }
}
