package com.alertengine.core.error;

/**
 * Thrown when the alert store cannot complete a read or write. The operation that hit it is
 * aborted as a whole; callers may retry.
 */
public class StorageFailureException extends AlertEngineException {
    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
