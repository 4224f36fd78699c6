package com.temporal.wcc.service.store;

/**
 * A unit of forest writes committed all-or-nothing.
 *
 * Reads through the transaction see its own pending writes. Implementations
 * verify at commit (or at write time) that every extended head still has no
 * outgoing edge and that every marked event was not processed concurrently,
 * failing with {@link ConcurrentMergeException} otherwise.
 */
public interface ForestTransaction extends ForestView {

    /**
     * Sets the processed flag on an unprocessed event.
     */
    void markProcessed(String eventId);

    /**
     * Adds the union-find link {@code headId -> eventId}.
     */
    void addForestEdge(String headId, String eventId);
}
