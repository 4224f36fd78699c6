package com.temporal.wcc.service.engine;

/**
 * Base exception for forest maintenance and feature extraction failures.
 *
 * Carries an error code that the API layer maps to an HTTP status.
 */
public class ForestException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public ForestException(String message, String errorCode) {
        this(message, null, errorCode, null);
    }

    public ForestException(String message, String entityId, String errorCode) {
        this(message, entityId, errorCode, null);
    }

    public ForestException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
