package com.temporal.wcc.service.engine;

/**
 * Features could not be computed for an event, typically because the store is unreachable.
 */
public class FeaturesUnavailableException extends ForestException {

    public FeaturesUnavailableException(String eventId, Throwable cause) {
        super("Features unavailable for event " + eventId + ": " + cause.getMessage(),
                eventId, "FEATURES_UNAVAILABLE", cause);
    }

    public FeaturesUnavailableException(String eventId, String reason) {
        super("Features unavailable for event " + eventId + ": " + reason,
                eventId, "FEATURES_UNAVAILABLE");
    }
}
