package com.temporal.wcc.service.store;

import com.temporal.wcc.service.model.Event;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the event graph needed by forest traversal.
 *
 * Implemented by the store itself and by an open transaction, so the same
 * traversal code reads committed state or a transaction's own writes.
 */
public interface ForestView {

    /**
     * Finds an event by id.
     */
    Optional<Event> findEvent(String eventId);

    /**
     * Ids of events with a precedence edge into the given event, across all entities.
     */
    Set<String> findPrecedencePredecessors(String eventId);

    /**
     * The node this event was absorbed into, if any.
     *
     * @throws com.temporal.wcc.service.engine.StructuralViolationException if the
     *         event has more than one outgoing forest edge
     */
    Optional<String> findForestSuccessor(String eventId);

    /**
     * Heads absorbed directly into the given event.
     */
    List<String> findForestPredecessors(String eventId);

    /**
     * Whether the event has already been merged into the forest.
     */
    boolean isProcessed(String eventId);
}
