package com.alertengine.core.error;

import com.alertengine.core.model.AlertStatus;

public class InvalidTransitionException extends AlertEngineException {
    public InvalidTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot move from " + from.value() + " to " + to.value());
    }
}
