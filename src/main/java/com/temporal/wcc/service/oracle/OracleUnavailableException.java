package com.temporal.wcc.service.oracle;

import com.temporal.wcc.service.engine.ForestException;

/**
 * A bulk oracle (component labels or shortest paths) could not answer.
 */
public class OracleUnavailableException extends ForestException {

    public OracleUnavailableException(String oracle, String message, Throwable cause) {
        super(oracle + " unavailable: " + message, null, "ORACLE_UNAVAILABLE", cause);
    }

    public OracleUnavailableException(String oracle, String message) {
        this(oracle, message, null);
    }
}
