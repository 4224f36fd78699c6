package com.temporal.wcc.service.store;

import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.model.PrecedenceEdge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Persistent store for events, entities, precedence chains and the union-find forest.
 *
 * Passed explicitly to every engine component so tests can run against the
 * in-memory implementation.
 */
public interface GraphStore extends ForestView {

    // ==================== Events & Entities ====================

    /**
     * Stores an event if absent.
     *
     * @return true if the event was created, false if it already existed
     */
    boolean saveEvent(Event event);

    /**
     * Records that an event touches an entity, creating the entity on first reference.
     */
    void addTouch(String eventId, Entity entity);

    /**
     * Entities touched by an event.
     */
    Set<Entity> findEntities(String eventId);

    /**
     * Events touching an entity, in no particular order.
     */
    List<Event> findEventsTouching(Entity entity);

    /**
     * All known entities.
     */
    Collection<Entity> findAllEntities();

    // ==================== Precedence Chains ====================

    /**
     * Precedence edges belonging to one entity's chain.
     */
    List<PrecedenceEdge> findPrecedenceEdges(Entity entity);

    /**
     * Inserts a precedence edge if absent.
     *
     * @return true if the edge was created
     */
    boolean addPrecedenceEdge(PrecedenceEdge edge);

    /**
     * Removes a precedence edge.
     *
     * @return true if an edge was removed
     */
    boolean removePrecedenceEdge(PrecedenceEdge edge);

    // ==================== Forest ====================

    /**
     * Unprocessed events in chronological order.
     */
    List<Event> findUnprocessedEvents();

    /**
     * Processed events in chronological order.
     */
    List<Event> findProcessedEvents();

    /**
     * Every forest edge in the store.
     */
    List<ForestEdge> findForestEdges();

    /**
     * Runs the work in a single write transaction and commits it atomically.
     * Nothing is applied if the work throws or the commit check fails.
     */
    <T> T inTransaction(Function<ForestTransaction, T> work);

    // ==================== Metrics ====================

    void saveMetrics(String eventId, ComponentMetrics metrics);

    Optional<ComponentMetrics> findMetrics(String eventId);

    // ==================== Administration ====================

    /**
     * Deletes all derived state (precedence edges, forest edges, processed flags, metrics)
     * in one atomic operation. Events, entities and touch edges are kept.
     */
    void reset();

    /**
     * Current element counts.
     */
    StoreStats stats();

    /**
     * Verifies the store is reachable.
     *
     * @throws StoreUnavailableException if it is not
     */
    void ping();

    /**
     * Element counts for monitoring.
     */
    record StoreStats(
            long eventCount,
            long entityCount,
            long touchCount,
            long precedenceEdgeCount,
            long forestEdgeCount,
            long processedCount,
            long metricsCount
    ) {}
}
