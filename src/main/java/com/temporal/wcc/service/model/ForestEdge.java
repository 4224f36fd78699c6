package com.temporal.wcc.service.model;

/**
 * Union-find link recording that {@code eventId} absorbed the component headed by {@code headId}.
 */
public record ForestEdge(String headId, String eventId) {
}
