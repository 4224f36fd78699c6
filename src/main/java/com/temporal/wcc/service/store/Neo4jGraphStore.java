package com.temporal.wcc.service.store;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.StructuralViolationException;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.EntityType;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.model.PrecedenceEdge;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * GraphStore backed by Neo4j over the Bolt driver.
 *
 * Every group merge runs in one managed write transaction; the head and processed
 * checks lock the touched nodes so concurrent merges of the same component conflict
 * instead of diverging.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "wcc.store", name = "type", havingValue = "neo4j")
public class Neo4jGraphStore implements GraphStore {

    private final Driver driver;
    private final WccConfig wccConfig;
    private final MetricsConfig metricsConfig;

    public Neo4jGraphStore(Driver driver, WccConfig wccConfig, MetricsConfig metricsConfig) {
        this.driver = driver;
        this.wccConfig = wccConfig;
        this.metricsConfig = metricsConfig;
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        execute(() -> {
            try (var session = openSession()) {
                session.executeWriteWithoutResult(tx -> tx.run(CypherQueries.EVENT_ID_CONSTRAINT).consume());
                session.executeWriteWithoutResult(tx -> tx.run(CypherQueries.ENTITY_KEY_CONSTRAINT).consume());
                session.executeWriteWithoutResult(tx -> tx.run(CypherQueries.EVENT_TIMESTAMP_INDEX).consume());
            }
            return null;
        });
        metricsConfig.registerStoreGauge(
                "wcc.store.events.count",
                "Number of events in Neo4j",
                () -> stats().eventCount()
        );
        log.info("Neo4jGraphStore initialized against {}", wccConfig.getNeo4j().getUri());
    }

    // ==================== Events & Entities ====================

    @Override
    public boolean saveEvent(Event event) {
        return write(tx -> tx.run(CypherQueries.SAVE_EVENT, Values.parameters(
                        "id", event.id(),
                        "timestamp", event.timestamp().toEpochMilli(),
                        "interactionType", event.interactionType(),
                        "amount", event.amount() != null ? event.amount().toPlainString() : null))
                .consume().counters().nodesCreated() > 0);
    }

    @Override
    public void addTouch(String eventId, Entity entity) {
        write(tx -> tx.run(CypherQueries.ADD_TOUCH, Values.parameters(
                        "eventId", eventId,
                        "uid", entity.toString(),
                        "type", entity.type().name(),
                        "key", entity.key()))
                .consume());
    }

    @Override
    public Optional<Event> findEvent(String eventId) {
        return read(tx -> findEvent(tx, eventId));
    }

    @Override
    public Set<Entity> findEntities(String eventId) {
        return read(tx -> Set.copyOf(tx.run(CypherQueries.FIND_ENTITIES, Values.parameters("id", eventId))
                .list(this::toEntity)));
    }

    @Override
    public List<Event> findEventsTouching(Entity entity) {
        return read(tx -> tx.run(CypherQueries.FIND_EVENTS_TOUCHING, Values.parameters("uid", entity.toString()))
                .list(this::toEvent));
    }

    @Override
    public Collection<Entity> findAllEntities() {
        return read(tx -> tx.run(CypherQueries.FIND_ALL_ENTITIES).list(this::toEntity));
    }

    // ==================== Precedence Chains ====================

    @Override
    public List<PrecedenceEdge> findPrecedenceEdges(Entity entity) {
        return read(tx -> tx.run(CypherQueries.FIND_PRECEDENCE_EDGES, entityParameters(entity))
                .list(r -> new PrecedenceEdge(r.get("fromId").asString(), r.get("toId").asString(), entity)));
    }

    @Override
    public boolean addPrecedenceEdge(PrecedenceEdge edge) {
        return write(tx -> tx.run(CypherQueries.ADD_PRECEDENCE_EDGE, edgeParameters(edge))
                .consume().counters().relationshipsCreated() > 0);
    }

    @Override
    public boolean removePrecedenceEdge(PrecedenceEdge edge) {
        return write(tx -> tx.run(CypherQueries.REMOVE_PRECEDENCE_EDGE, edgeParameters(edge))
                .consume().counters().relationshipsDeleted() > 0);
    }

    @Override
    public Set<String> findPrecedencePredecessors(String eventId) {
        return read(tx -> findPrecedencePredecessors(tx, eventId));
    }

    // ==================== Forest ====================

    @Override
    public Optional<String> findForestSuccessor(String eventId) {
        return read(tx -> findForestSuccessor(tx, eventId));
    }

    @Override
    public List<String> findForestPredecessors(String eventId) {
        return read(tx -> findForestPredecessors(tx, eventId));
    }

    @Override
    public boolean isProcessed(String eventId) {
        return read(tx -> isProcessed(tx, eventId));
    }

    @Override
    public List<Event> findUnprocessedEvents() {
        return read(tx -> tx.run(CypherQueries.FIND_UNPROCESSED).list(this::toEvent));
    }

    @Override
    public List<Event> findProcessedEvents() {
        return read(tx -> tx.run(CypherQueries.FIND_PROCESSED).list(this::toEvent));
    }

    @Override
    public List<ForestEdge> findForestEdges() {
        return read(tx -> tx.run(CypherQueries.FIND_FOREST_EDGES)
                .list(r -> new ForestEdge(r.get("headId").asString(), r.get("eventId").asString())));
    }

    @Override
    public <T> T inTransaction(Function<ForestTransaction, T> work) {
        return write(tx -> work.apply(new Neo4jTransaction(tx)));
    }

    // ==================== Metrics ====================

    @Override
    public void saveMetrics(String eventId, ComponentMetrics metrics) {
        write(tx -> tx.run(CypherQueries.SAVE_METRICS, Values.parameters(
                        "id", eventId,
                        "size", metrics.componentSize(),
                        "diameter", metrics.componentDiameter(),
                        "velocity", metrics.componentVelocity()))
                .consume());
    }

    @Override
    public Optional<ComponentMetrics> findMetrics(String eventId) {
        return read(tx -> tx.run(CypherQueries.FIND_METRICS, Values.parameters("id", eventId))
                .list(this::toMetrics)
                .stream()
                .findFirst());
    }

    // ==================== Administration ====================

    @Override
    public void reset() {
        write(tx -> {
            tx.run(CypherQueries.DELETE_DERIVED_EDGES).consume();
            tx.run(CypherQueries.CLEAR_DERIVED_PROPERTIES).consume();
            return null;
        });
        log.info("Neo4j forest reset: derived state cleared");
    }

    @Override
    public StoreStats stats() {
        return read(tx -> {
            var r = tx.run(CypherQueries.STATS).single();
            return new StoreStats(
                    r.get("events").asLong(),
                    r.get("entities").asLong(),
                    r.get("touches").asLong(),
                    r.get("precedence").asLong(),
                    r.get("forest").asLong(),
                    r.get("processed").asLong(),
                    r.get("metrics").asLong()
            );
        });
    }

    @Override
    public void ping() {
        read(tx -> tx.run(CypherQueries.PING).single().get("ok").asInt());
    }

    // ==================== Transaction-scoped Reads ====================

    private Optional<Event> findEvent(TransactionContext tx, String eventId) {
        return tx.run(CypherQueries.FIND_EVENT, Values.parameters("id", eventId))
                .list(this::toEvent)
                .stream()
                .findFirst();
    }

    private Set<String> findPrecedencePredecessors(TransactionContext tx, String eventId) {
        return new LinkedHashSet<>(tx.run(CypherQueries.FIND_PRECEDENCE_PREDECESSORS, Values.parameters("id", eventId))
                .list(r -> r.get("id").asString()));
    }

    private Optional<String> findForestSuccessor(TransactionContext tx, String eventId) {
        var successors = tx.run(CypherQueries.FIND_FOREST_SUCCESSORS, Values.parameters("id", eventId))
                .list(r -> r.get("id").asString());
        if (successors.size() > 1) {
            throw new StructuralViolationException(
                    "Event " + eventId + " has " + successors.size() + " outgoing forest edges", eventId);
        }
        return successors.stream().findFirst();
    }

    private List<String> findForestPredecessors(TransactionContext tx, String eventId) {
        return tx.run(CypherQueries.FIND_FOREST_PREDECESSORS, Values.parameters("id", eventId))
                .list(r -> r.get("id").asString());
    }

    private boolean isProcessed(TransactionContext tx, String eventId) {
        return tx.run(CypherQueries.IS_PROCESSED, Values.parameters("id", eventId))
                .list(r -> r.get("processed").asBoolean())
                .stream()
                .findFirst()
                .orElse(false);
    }

    // ==================== Session Helpers ====================

    private Session openSession() {
        var database = wccConfig.getNeo4j().getDatabase();
        return database == null || database.isBlank()
                ? driver.session()
                : driver.session(SessionConfig.forDatabase(database));
    }

    private <T> T read(Function<TransactionContext, T> work) {
        return execute(() -> {
            try (var session = openSession()) {
                return session.executeRead(work::apply);
            }
        });
    }

    private <T> T write(Function<TransactionContext, T> work) {
        return execute(() -> {
            try (var session = openSession()) {
                return session.executeWrite(work::apply);
            }
        });
    }

    private <T> T execute(Supplier<T> action) {
        try {
            return action.get();
        } catch (ServiceUnavailableException e) {
            throw new StoreUnavailableException("Neo4j unavailable: " + e.getMessage(), e);
        } catch (TransientException | SessionExpiredException e) {
            throw new TransientStoreException("Transient Neo4j failure: " + e.getMessage(), null, e);
        }
    }

    // ==================== Mapping ====================

    private Event toEvent(Record r) {
        Value amount = r.get("amount");
        Value interactionType = r.get("interactionType");
        return new Event(
                r.get("id").asString(),
                Instant.ofEpochMilli(r.get("timestamp").asLong()),
                interactionType.isNull() ? null : interactionType.asString(),
                amount.isNull() ? null : new BigDecimal(amount.asString())
        );
    }

    private Entity toEntity(Record r) {
        return Entity.of(EntityType.valueOf(r.get("type").asString()), r.get("key").asString());
    }

    private ComponentMetrics toMetrics(Record r) {
        Value diameter = r.get("diameter");
        return new ComponentMetrics(
                r.get("size").asLong(),
                diameter.isNull() ? null : diameter.asInt(),
                r.get("velocity").asDouble()
        );
    }

    private Value entityParameters(Entity entity) {
        return Values.parameters("type", entity.type().name(), "key", entity.key());
    }

    private Value edgeParameters(PrecedenceEdge edge) {
        return Values.parameters(
                "fromId", edge.fromEventId(),
                "toId", edge.toEventId(),
                "type", edge.entity().type().name(),
                "key", edge.entity().key());
    }

    // ==================== Transaction ====================

    /**
     * Forest transaction over an open Neo4j write transaction; checks run at write time
     * under node locks, and any failure rolls back the whole managed transaction.
     */
    private class Neo4jTransaction implements ForestTransaction {

        private final TransactionContext tx;

        Neo4jTransaction(TransactionContext tx) {
            this.tx = tx;
        }

        @Override
        public Optional<Event> findEvent(String eventId) {
            return Neo4jGraphStore.this.findEvent(tx, eventId);
        }

        @Override
        public Set<String> findPrecedencePredecessors(String eventId) {
            return Neo4jGraphStore.this.findPrecedencePredecessors(tx, eventId);
        }

        @Override
        public Optional<String> findForestSuccessor(String eventId) {
            return Neo4jGraphStore.this.findForestSuccessor(tx, eventId);
        }

        @Override
        public List<String> findForestPredecessors(String eventId) {
            return Neo4jGraphStore.this.findForestPredecessors(tx, eventId);
        }

        @Override
        public boolean isProcessed(String eventId) {
            return Neo4jGraphStore.this.isProcessed(tx, eventId);
        }

        @Override
        public void markProcessed(String eventId) {
            long marked = tx.run(CypherQueries.MARK_PROCESSED, Values.parameters("id", eventId))
                    .single().get("marked").asLong();
            if (marked == 0) {
                throw new ConcurrentMergeException("Event already processed: " + eventId, eventId);
            }
        }

        @Override
        public void addForestEdge(String headId, String eventId) {
            long created = tx.run(CypherQueries.ADD_FOREST_EDGE,
                            Values.parameters("headId", headId, "eventId", eventId))
                    .single().get("created").asLong();
            if (created == 0) {
                throw new ConcurrentMergeException("Head " + headId + " was already absorbed", eventId);
            }
        }
    }
}
