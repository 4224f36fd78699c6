package com.temporal.wcc.service.store;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.model.PrecedenceEdge;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory implementation of GraphStore.
 *
 * Thread-safe: reads share a read lock, mutations and transaction commits take the
 * write lock. Transactions buffer their writes and validate them at commit.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "wcc.store", name = "type", havingValue = "memory", matchIfMissing = true)
@RequiredArgsConstructor
public class InMemoryGraphStore implements GraphStore {

    private final MetricsConfig metricsConfig;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Event> events = new HashMap<>();
    private final Map<String, Set<Entity>> entitiesByEvent = new HashMap<>();
    private final Map<Entity, Set<String>> eventsByEntity = new LinkedHashMap<>();

    private final Map<Entity, Set<PrecedenceEdge>> precedenceByEntity = new HashMap<>();
    private final Map<String, Set<PrecedenceEdge>> precedenceIncoming = new HashMap<>();

    private final Map<String, String> forestSuccessor = new HashMap<>();
    private final Map<String, Set<String>> forestPredecessors = new HashMap<>();
    private final Set<String> processed = new HashSet<>();
    private final Map<String, ComponentMetrics> metrics = new HashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "wcc.store.events.count",
                "Number of events in memory",
                () -> stats().eventCount()
        );
        metricsConfig.registerStoreGauge(
                "wcc.store.forest.edges.count",
                "Number of forest edges in memory",
                () -> stats().forestEdgeCount()
        );
        log.info("InMemoryGraphStore initialized");
    }

    // ==================== Events & Entities ====================

    @Override
    public boolean saveEvent(Event event) {
        return write(() -> {
            if (events.containsKey(event.id())) {
                return false;
            }
            events.put(event.id(), event);
            entitiesByEvent.put(event.id(), new LinkedHashSet<>());
            return true;
        });
    }

    @Override
    public void addTouch(String eventId, Entity entity) {
        write(() -> {
            requireEvent(eventId);
            entitiesByEvent.get(eventId).add(entity);
            eventsByEntity.computeIfAbsent(entity, k -> new LinkedHashSet<>()).add(eventId);
            return null;
        });
    }

    @Override
    public Optional<Event> findEvent(String eventId) {
        return read(() -> Optional.ofNullable(events.get(eventId)));
    }

    @Override
    public Set<Entity> findEntities(String eventId) {
        return read(() -> Set.copyOf(entitiesByEvent.getOrDefault(eventId, Set.of())));
    }

    @Override
    public List<Event> findEventsTouching(Entity entity) {
        return read(() -> eventsByEntity.getOrDefault(entity, Set.of()).stream()
                .map(events::get)
                .toList());
    }

    @Override
    public Collection<Entity> findAllEntities() {
        return read(() -> List.copyOf(eventsByEntity.keySet()));
    }

    // ==================== Precedence Chains ====================

    @Override
    public List<PrecedenceEdge> findPrecedenceEdges(Entity entity) {
        return read(() -> List.copyOf(precedenceByEntity.getOrDefault(entity, Set.of())));
    }

    @Override
    public boolean addPrecedenceEdge(PrecedenceEdge edge) {
        return write(() -> {
            requireEvent(edge.fromEventId());
            requireEvent(edge.toEventId());
            boolean created = precedenceByEntity
                    .computeIfAbsent(edge.entity(), k -> new LinkedHashSet<>())
                    .add(edge);
            if (created) {
                precedenceIncoming.computeIfAbsent(edge.toEventId(), k -> new LinkedHashSet<>()).add(edge);
            }
            return created;
        });
    }

    @Override
    public boolean removePrecedenceEdge(PrecedenceEdge edge) {
        return write(() -> {
            var chain = precedenceByEntity.get(edge.entity());
            boolean removed = chain != null && chain.remove(edge);
            if (removed) {
                precedenceIncoming.getOrDefault(edge.toEventId(), new HashSet<>()).remove(edge);
            }
            return removed;
        });
    }

    @Override
    public Set<String> findPrecedencePredecessors(String eventId) {
        return read(() -> committedPrecedencePredecessors(eventId));
    }

    // ==================== Forest ====================

    @Override
    public Optional<String> findForestSuccessor(String eventId) {
        return read(() -> Optional.ofNullable(forestSuccessor.get(eventId)));
    }

    @Override
    public List<String> findForestPredecessors(String eventId) {
        return read(() -> sortChronologically(forestPredecessors.getOrDefault(eventId, Set.of())));
    }

    @Override
    public boolean isProcessed(String eventId) {
        return read(() -> processed.contains(eventId));
    }

    @Override
    public List<Event> findUnprocessedEvents() {
        return read(() -> events.values().stream()
                .filter(event -> !processed.contains(event.id()))
                .sorted(Event.CHRONOLOGICAL)
                .toList());
    }

    @Override
    public List<Event> findProcessedEvents() {
        return read(() -> processed.stream()
                .map(events::get)
                .sorted(Event.CHRONOLOGICAL)
                .toList());
    }

    @Override
    public List<ForestEdge> findForestEdges() {
        return read(() -> forestSuccessor.entrySet().stream()
                .map(entry -> new ForestEdge(entry.getKey(), entry.getValue()))
                .toList());
    }

    @Override
    public <T> T inTransaction(Function<ForestTransaction, T> work) {
        var tx = new InMemoryTransaction();
        T result = work.apply(tx);
        tx.commit();
        return result;
    }

    // ==================== Metrics ====================

    @Override
    public void saveMetrics(String eventId, ComponentMetrics value) {
        write(() -> {
            requireEvent(eventId);
            metrics.put(eventId, value);
            return null;
        });
    }

    @Override
    public Optional<ComponentMetrics> findMetrics(String eventId) {
        return read(() -> Optional.ofNullable(metrics.get(eventId)));
    }

    // ==================== Administration ====================

    @Override
    public void reset() {
        write(() -> {
            precedenceByEntity.clear();
            precedenceIncoming.clear();
            forestSuccessor.clear();
            forestPredecessors.clear();
            processed.clear();
            metrics.clear();
            return null;
        });
        log.info("In-memory forest reset: derived state cleared");
    }

    @Override
    public StoreStats stats() {
        return read(() -> new StoreStats(
                events.size(),
                eventsByEntity.size(),
                entitiesByEvent.values().stream().mapToLong(Set::size).sum(),
                precedenceByEntity.values().stream().mapToLong(Set::size).sum(),
                forestSuccessor.size(),
                processed.size(),
                metrics.size()
        ));
    }

    @Override
    public void ping() {
        // always reachable
    }

    // ==================== Helpers ====================

    private Set<String> committedPrecedencePredecessors(String eventId) {
        var result = new LinkedHashSet<String>();
        for (var edge : precedenceIncoming.getOrDefault(eventId, Set.of())) {
            result.add(edge.fromEventId());
        }
        return result;
    }

    private List<String> sortChronologically(Collection<String> eventIds) {
        return eventIds.stream()
                .map(events::get)
                .sorted(Event.CHRONOLOGICAL)
                .map(Event::id)
                .toList();
    }

    private void requireEvent(String eventId) {
        if (!events.containsKey(eventId)) {
            throw new IllegalArgumentException("Unknown event: " + eventId);
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Transaction ====================

    /**
     * Buffers forest writes and applies them at commit if every optimistic check still holds.
     */
    private class InMemoryTransaction implements ForestTransaction {

        private final Set<String> pendingProcessed = new LinkedHashSet<>();
        private final Map<String, String> pendingSuccessor = new LinkedHashMap<>();

        @Override
        public Optional<Event> findEvent(String eventId) {
            return InMemoryGraphStore.this.findEvent(eventId);
        }

        @Override
        public Set<String> findPrecedencePredecessors(String eventId) {
            return InMemoryGraphStore.this.findPrecedencePredecessors(eventId);
        }

        @Override
        public Optional<String> findForestSuccessor(String eventId) {
            var pending = pendingSuccessor.get(eventId);
            var committed = InMemoryGraphStore.this.findForestSuccessor(eventId);
            if (pending != null && committed.isPresent()) {
                throw new ConcurrentMergeException(
                        "Head " + eventId + " was extended by another merge", eventId);
            }
            return pending != null ? Optional.of(pending) : committed;
        }

        @Override
        public List<String> findForestPredecessors(String eventId) {
            var result = new ArrayList<>(InMemoryGraphStore.this.findForestPredecessors(eventId));
            pendingSuccessor.forEach((head, target) -> {
                if (target.equals(eventId)) {
                    result.add(head);
                }
            });
            return result;
        }

        @Override
        public boolean isProcessed(String eventId) {
            return pendingProcessed.contains(eventId) || InMemoryGraphStore.this.isProcessed(eventId);
        }

        @Override
        public void markProcessed(String eventId) {
            if (isProcessed(eventId)) {
                throw new ConcurrentMergeException("Event already processed: " + eventId, eventId);
            }
            pendingProcessed.add(eventId);
        }

        @Override
        public void addForestEdge(String headId, String eventId) {
            if (findForestSuccessor(headId).isPresent()) {
                throw new ConcurrentMergeException(
                        "Head " + headId + " was already absorbed", eventId);
            }
            pendingSuccessor.put(headId, eventId);
        }

        void commit() {
            if (pendingProcessed.isEmpty() && pendingSuccessor.isEmpty()) {
                return;
            }
            write(() -> {
                verify();
                apply();
                return null;
            });
        }

        private void verify() {
            for (var eventId : pendingProcessed) {
                requireEvent(eventId);
                if (processed.contains(eventId)) {
                    throw new ConcurrentMergeException(
                            "Event processed concurrently: " + eventId, eventId);
                }
            }
            for (var edge : pendingSuccessor.entrySet()) {
                if (forestSuccessor.containsKey(edge.getKey())) {
                    throw new ConcurrentMergeException(
                            "Head " + edge.getKey() + " extended concurrently", edge.getValue());
                }
                if (!processed.contains(edge.getKey()) && !pendingProcessed.contains(edge.getKey())) {
                    throw new ConcurrentMergeException(
                            "Head " + edge.getKey() + " is not processed", edge.getValue());
                }
            }
        }

        private void apply() {
            processed.addAll(pendingProcessed);
            pendingSuccessor.forEach((head, target) -> {
                forestSuccessor.put(head, target);
                forestPredecessors.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(head);
            });
        }
    }
}
