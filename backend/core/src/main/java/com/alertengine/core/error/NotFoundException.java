package com.alertengine.core.error;

public class NotFoundException extends AlertEngineException {
    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
