package com.temporal.wcc.service.store;

import com.temporal.wcc.service.engine.ForestException;

/**
 * A store failure that may succeed when the unit of work is retried
 * (timeouts, lock conflicts, lost optimistic checks).
 */
public class TransientStoreException extends ForestException {

    public TransientStoreException(String message, String entityId, Throwable cause) {
        super(message, entityId, "TRANSIENT_STORE_ERROR", cause);
    }

    protected TransientStoreException(String message, String entityId, String errorCode) {
        super(message, entityId, errorCode);
    }
}
