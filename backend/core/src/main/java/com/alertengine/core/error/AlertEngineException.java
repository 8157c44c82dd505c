package com.alertengine.core.error;

public class AlertEngineException extends RuntimeException {
    public AlertEngineException(String message) {
        super(message);
    }

    public AlertEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
