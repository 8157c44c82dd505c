package com.alertengine.core.error;

public class InvalidPriorityFilterException extends AlertEngineException {
    public InvalidPriorityFilterException(String value, String allowed) {
        super("Invalid priority '" + value + "'. Must be one of: " + allowed);
    }
}
