package com.temporal.wcc.service.model;

/**
 * Directed link from an event to the chronologically next event sharing {@code entity}.
 */
public record PrecedenceEdge(String fromEventId, String toEventId, Entity entity) {
}
