package com.temporal.wcc.service.engine;

/**
 * Metrics for one forest node could not be computed.
 */
public class MetricsComputationException extends ForestException {

    public MetricsComputationException(String eventId, String message, Throwable cause) {
        super(message, eventId, "METRICS_FAILED", cause);
    }
}
