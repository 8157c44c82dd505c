package com.alertengine.core.error;

public class InvalidCategoryException extends AlertEngineException {
    public InvalidCategoryException(String value, String allowed) {
        super("Invalid category '" + value + "'. Must be one of: " + allowed);
    }
}
