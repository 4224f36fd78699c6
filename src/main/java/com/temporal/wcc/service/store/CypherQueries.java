package com.temporal.wcc.service.store;

/**
 * Parameterized Cypher statements used by {@link Neo4jGraphStore}.
 *
 * Graph layout: {@code (:Event)-[:TOUCHES]->(:Entity {uid, type, key})},
 * {@code (:Event)-[:PRECEDES {entityType, entityKey}]->(:Event)} and the union-find
 * forest {@code (:Event)-[:CC]->(:Event)}. Processed flag and component metrics
 * are properties of the event node.
 */
final class CypherQueries {

    private CypherQueries() {
    }

    // ==================== Schema ====================

    static final String EVENT_ID_CONSTRAINT = """
            CREATE CONSTRAINT event_id IF NOT EXISTS \
            FOR (e:Event) REQUIRE e.id IS UNIQUE""";

    static final String ENTITY_KEY_CONSTRAINT = """
            CREATE CONSTRAINT entity_key IF NOT EXISTS \
            FOR (n:Entity) REQUIRE n.uid IS UNIQUE""";

    static final String EVENT_TIMESTAMP_INDEX = """
            CREATE INDEX event_timestamp IF NOT EXISTS \
            FOR (e:Event) ON (e.timestamp)""";

    // ==================== Events & Entities ====================

    static final String SAVE_EVENT = """
            MERGE (e:Event {id: $id}) \
            ON CREATE SET e.timestamp = $timestamp, e.interactionType = $interactionType, \
            e.amount = $amount, e.processed = false""";

    static final String ADD_TOUCH = """
            MATCH (e:Event {id: $eventId}) \
            MERGE (n:Entity {uid: $uid}) \
            ON CREATE SET n.type = $type, n.key = $key \
            MERGE (e)-[:TOUCHES]->(n)""";

    static final String FIND_EVENT = """
            MATCH (e:Event {id: $id}) \
            RETURN e.id AS id, e.timestamp AS timestamp, \
            e.interactionType AS interactionType, e.amount AS amount""";

    static final String FIND_ENTITIES = """
            MATCH (:Event {id: $id})-[:TOUCHES]->(n:Entity) \
            RETURN n.type AS type, n.key AS key""";

    static final String FIND_EVENTS_TOUCHING = """
            MATCH (:Entity {uid: $uid})<-[:TOUCHES]-(e:Event) \
            RETURN e.id AS id, e.timestamp AS timestamp, \
            e.interactionType AS interactionType, e.amount AS amount""";

    static final String FIND_ALL_ENTITIES = """
            MATCH (n:Entity) \
            RETURN n.type AS type, n.key AS key""";

    // ==================== Precedence Chains ====================

    static final String FIND_PRECEDENCE_EDGES = """
            MATCH (a:Event)-[:PRECEDES {entityType: $type, entityKey: $key}]->(b:Event) \
            RETURN a.id AS fromId, b.id AS toId""";

    static final String ADD_PRECEDENCE_EDGE = """
            MATCH (a:Event {id: $fromId}), (b:Event {id: $toId}) \
            MERGE (a)-[:PRECEDES {entityType: $type, entityKey: $key}]->(b)""";

    static final String REMOVE_PRECEDENCE_EDGE = """
            MATCH (:Event {id: $fromId})-[r:PRECEDES {entityType: $type, entityKey: $key}]->(:Event {id: $toId}) \
            DELETE r""";

    static final String FIND_PRECEDENCE_PREDECESSORS = """
            MATCH (p:Event)-[:PRECEDES]->(:Event {id: $id}) \
            RETURN DISTINCT p.id AS id""";

    // ==================== Forest ====================

    static final String FIND_FOREST_SUCCESSORS = """
            MATCH (:Event {id: $id})-[:CC]->(n:Event) \
            RETURN n.id AS id""";

    static final String FIND_FOREST_PREDECESSORS = """
            MATCH (p:Event)-[:CC]->(:Event {id: $id}) \
            RETURN p.id AS id ORDER BY p.timestamp, p.id""";

    static final String IS_PROCESSED = """
            MATCH (e:Event {id: $id}) \
            RETURN coalesce(e.processed, false) AS processed""";

    static final String FIND_UNPROCESSED = """
            MATCH (e:Event) WHERE coalesce(e.processed, false) = false \
            RETURN e.id AS id, e.timestamp AS timestamp, \
            e.interactionType AS interactionType, e.amount AS amount \
            ORDER BY e.timestamp, e.id""";

    static final String FIND_PROCESSED = """
            MATCH (e:Event) WHERE e.processed = true \
            RETURN e.id AS id, e.timestamp AS timestamp, \
            e.interactionType AS interactionType, e.amount AS amount \
            ORDER BY e.timestamp, e.id""";

    static final String FIND_FOREST_EDGES = """
            MATCH (h:Event)-[:CC]->(e:Event) \
            RETURN h.id AS headId, e.id AS eventId""";

    /**
     * Writing the property takes the node's write lock, which serializes the check below it.
     */
    static final String MARK_PROCESSED = """
            MATCH (e:Event {id: $id}) \
            SET e.mergeVersion = coalesce(e.mergeVersion, 0) + 1 \
            WITH e WHERE coalesce(e.processed, false) = false \
            SET e.processed = true \
            RETURN count(e) AS marked""";

    static final String ADD_FOREST_EDGE = """
            MATCH (h:Event {id: $headId}), (e:Event {id: $eventId}) \
            SET h.mergeVersion = coalesce(h.mergeVersion, 0) + 1 \
            WITH h, e WHERE NOT EXISTS { (h)-[:CC]->() } \
            CREATE (h)-[:CC]->(e) \
            RETURN count(*) AS created""";

    // ==================== Metrics ====================

    static final String SAVE_METRICS = """
            MATCH (e:Event {id: $id}) \
            SET e.componentSize = $size, e.componentDiameter = $diameter, \
            e.componentVelocity = $velocity""";

    static final String FIND_METRICS = """
            MATCH (e:Event {id: $id}) WHERE e.componentSize IS NOT NULL \
            RETURN e.componentSize AS size, e.componentDiameter AS diameter, \
            e.componentVelocity AS velocity""";

    // ==================== Administration ====================

    static final String DELETE_DERIVED_EDGES = """
            MATCH (:Event)-[r:PRECEDES|CC]->(:Event) \
            DELETE r""";

    static final String CLEAR_DERIVED_PROPERTIES = """
            MATCH (e:Event) \
            SET e.processed = false \
            REMOVE e.componentSize, e.componentDiameter, e.componentVelocity, e.mergeVersion""";

    static final String STATS = """
            CALL { MATCH (e:Event) RETURN count(e) AS events, \
                   sum(CASE WHEN e.processed = true THEN 1 ELSE 0 END) AS processed, \
                   sum(CASE WHEN e.componentSize IS NOT NULL THEN 1 ELSE 0 END) AS metrics } \
            CALL { MATCH (n:Entity) RETURN count(n) AS entities } \
            CALL { MATCH (:Event)-[t:TOUCHES]->(:Entity) RETURN count(t) AS touches } \
            CALL { MATCH (:Event)-[p:PRECEDES]->(:Event) RETURN count(p) AS precedence } \
            CALL { MATCH (:Event)-[c:CC]->(:Event) RETURN count(c) AS forest } \
            RETURN events, entities, touches, precedence, forest, processed, metrics""";

    static final String PING = "RETURN 1 AS ok";
}
