package com.temporal.wcc.service.store;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.BatchCoordinator;
import com.temporal.wcc.service.engine.ComponentMetricsEngine;
import com.temporal.wcc.service.engine.SequentialChainBuilder;
import com.temporal.wcc.service.engine.TemporalUnionFindForest;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.EntityType;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.oracle.BreadthFirstComponentLabelOracle;
import com.temporal.wcc.service.oracle.BreadthFirstShortestPathOracle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the store contract against a real Neo4j. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class Neo4jGraphStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Container
    static final Neo4jContainer<?> NEO4J = new Neo4jContainer<>("neo4j:5").withAdminPassword("password");

    private static Driver driver;

    private final WccConfig config = new WccConfig();
    private final MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
    private Neo4jGraphStore store;

    @BeforeAll
    static void connect() {
        driver = GraphDatabase.driver(NEO4J.getBoltUrl(), AuthTokens.basic("neo4j", NEO4J.getAdminPassword()));
    }

    @AfterAll
    static void disconnect() {
        driver.close();
    }

    @BeforeEach
    void setUp() {
        config.getNeo4j().setUri(NEO4J.getBoltUrl());
        config.getBatch().setShuffleSeed(3L);
        config.getBatch().setBackoffMs(5);
        try (var session = driver.session()) {
            session.run("MATCH (n) DETACH DELETE n").consume();
        }
        store = new Neo4jGraphStore(driver, config, metrics);
        store.init();
    }

    @Test
    @DisplayName("Events, entities and touches round through Neo4j")
    void storesEvents() {
        assertThat(store.saveEvent(Event.of("n1", T0))).isTrue();
        assertThat(store.saveEvent(Event.of("n1", T0.plusSeconds(5)))).isFalse();
        store.addTouch("n1", Entity.of(EntityType.EMAIL, "Neo@Example.com"));

        assertThat(store.findEvent("n1")).get().extracting(Event::timestamp).isEqualTo(T0);
        assertThat(store.findEntities("n1")).containsExactly(Entity.of(EntityType.EMAIL, "neo@example.com"));
        assertThat(store.findEventsTouching(Entity.of(EntityType.EMAIL, "neo@example.com")))
                .extracting(Event::id).containsExactly("n1");
    }

    @Test
    @DisplayName("A linear chain merges into one component with the expected metrics")
    void mergesLinearChain() {
        var ip = Entity.of(EntityType.IP_ADDRESS, "10.0.0.1");
        var email = Entity.of(EntityType.EMAIL, "shared@example.com");
        var device = Entity.of(EntityType.DEVICE, "dev-a");
        save("a1", 0, ip);
        save("a2", 10, ip, email);
        save("a3", 20, email, device);
        save("a4", 30, device);

        var forest = new TemporalUnionFindForest(config);
        new SequentialChainBuilder(store, metrics).linkAll();
        var report = new BatchCoordinator(store, forest, new BreadthFirstComponentLabelOracle(), config, metrics)
                .runBatch();
        new ComponentMetricsEngine(store, new BreadthFirstShortestPathOracle(), config, metrics).computeMissing();

        assertThat(report.isSuccessful()).isTrue();
        assertThat(store.findForestEdges()).containsExactlyInAnyOrder(
                new ForestEdge("a1", "a2"), new ForestEdge("a2", "a3"), new ForestEdge("a3", "a4"));
        assertThat(forest.findHead(store, "a1")).isEqualTo("a4");
        assertThat(store.findMetrics("a4")).contains(new ComponentMetrics(4, 2, 0.1));
        assertThat(store.findUnprocessedEvents()).isEmpty();
    }

    @Test
    @DisplayName("Extending an already extended head is rejected")
    void rejectsSecondSuccessor() {
        save("h", 0);
        save("x", 1);
        save("y", 2);
        store.inTransaction(tx -> {
            tx.markProcessed("h");
            tx.markProcessed("x");
            tx.addForestEdge("h", "x");
            return null;
        });

        assertThatThrownBy(() -> store.inTransaction(tx -> {
            tx.markProcessed("y");
            tx.addForestEdge("h", "y");
            return null;
        })).isInstanceOf(TransientStoreException.class);

        assertThat(store.isProcessed("y")).isFalse();
    }

    @Test
    @DisplayName("Reset keeps events and touches")
    void resetKeepsEvents() {
        var card = Entity.of(EntityType.CREDIT_CARD, "4111");
        save("r1", 0, card);
        save("r2", 5, card);
        new SequentialChainBuilder(store, metrics).linkAll();

        store.reset();

        var stats = store.stats();
        assertThat(stats.eventCount()).isEqualTo(2);
        assertThat(stats.touchCount()).isEqualTo(2);
        assertThat(stats.precedenceEdgeCount()).isZero();
    }

    private void save(String id, long seconds, Entity... entities) {
        store.saveEvent(Event.of(id, T0.plusSeconds(seconds)));
        for (var entity : entities) {
            store.addTouch(id, entity);
        }
    }
}
