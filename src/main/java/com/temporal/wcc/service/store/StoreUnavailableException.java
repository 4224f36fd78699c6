package com.temporal.wcc.service.store;

import com.temporal.wcc.service.engine.ForestException;

/**
 * The backing store cannot be reached.
 */
public class StoreUnavailableException extends ForestException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, null, "STORE_UNAVAILABLE", cause);
    }
}
