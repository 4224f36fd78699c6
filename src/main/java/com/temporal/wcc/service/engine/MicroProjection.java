package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.model.Entity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Bounded bipartite subgraph of one component snapshot: its events and the entities they touch.
 *
 * Node ids are namespaced ({@code event:} / {@code entity:}) so events and entities never collide.
 */
public final class MicroProjection {

    private static final String EVENT_PREFIX = "event:";
    private static final String ENTITY_PREFIX = "entity:";

    private final Map<String, Set<String>> adjacency;
    private final List<String> eventNodes;
    private final int touchEdgeCount;

    private MicroProjection(Map<String, Set<String>> adjacency, List<String> eventNodes, int touchEdgeCount) {
        this.adjacency = adjacency;
        this.eventNodes = eventNodes;
        this.touchEdgeCount = touchEdgeCount;
    }

    /**
     * Builds the projection of the given events.
     *
     * @param eventIds   events of the snapshot
     * @param entitiesOf touch lookup for one event
     */
    public static MicroProjection of(Collection<String> eventIds, Function<String, Set<Entity>> entitiesOf) {
        var adjacency = new LinkedHashMap<String, Set<String>>();
        int touches = 0;
        for (var eventId : eventIds) {
            var eventNode = eventNode(eventId);
            adjacency.computeIfAbsent(eventNode, k -> new LinkedHashSet<>());
            for (var entity : entitiesOf.apply(eventId)) {
                var entityNode = entityNode(entity);
                if (adjacency.get(eventNode).add(entityNode)) {
                    touches++;
                }
                adjacency.computeIfAbsent(entityNode, k -> new LinkedHashSet<>()).add(eventNode);
            }
        }
        var events = eventIds.stream().map(MicroProjection::eventNode).distinct().toList();
        return new MicroProjection(adjacency, events, touches);
    }

    public static String eventNode(String eventId) {
        return EVENT_PREFIX + eventId;
    }

    public static String entityNode(Entity entity) {
        return ENTITY_PREFIX + entity;
    }

    public static boolean isEventNode(String nodeId) {
        return nodeId.startsWith(EVENT_PREFIX);
    }

    public boolean contains(String nodeId) {
        return adjacency.containsKey(nodeId);
    }

    public Set<String> neighbors(String nodeId) {
        return adjacency.getOrDefault(nodeId, Set.of());
    }

    public List<String> eventNodes() {
        return eventNodes;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int touchEdgeCount() {
        return touchEdgeCount;
    }
}
