package com.temporal.wcc.service.store;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.EntityType;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.model.PrecedenceEdge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");
    private static final Entity CARD = Entity.of(EntityType.CREDIT_CARD, "5500-0000");

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(new MetricsConfig(new SimpleMeterRegistry()));
        for (int i = 1; i <= 3; i++) {
            store.saveEvent(Event.of("e" + i, T0.plusSeconds(i)));
            store.addTouch("e" + i, CARD);
        }
    }

    @Nested
    @DisplayName("Events and entities")
    class EventsAndEntities {

        @Test
        @DisplayName("Saving an existing event id is a no-op")
        void duplicateEvent() {
            boolean created = store.saveEvent(Event.of("e1", T0.plusSeconds(99)));

            assertThat(created).isFalse();
            assertThat(store.findEvent("e1")).get().extracting(Event::timestamp).isEqualTo(T0.plusSeconds(1));
        }

        @Test
        @DisplayName("Email entities differing only in case are the same entity")
        void emailNormalization() {
            store.addTouch("e1", Entity.of(EntityType.EMAIL, "Bob@Example.com"));
            store.addTouch("e2", Entity.of(EntityType.EMAIL, "bob@example.com "));

            assertThat(store.findEventsTouching(Entity.of(EntityType.EMAIL, "BOB@EXAMPLE.COM")))
                    .extracting(Event::id)
                    .containsExactlyInAnyOrder("e1", "e2");
        }

        @Test
        @DisplayName("Touching an unknown event fails")
        void touchUnknownEvent() {
            assertThatThrownBy(() -> store.addTouch("ghost", CARD))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ghost");
        }
    }

    @Nested
    @DisplayName("Forest transactions")
    class Transactions {

        @Test
        @DisplayName("Writes become visible only at commit")
        void commitsAtomically() {
            store.inTransaction(tx -> {
                tx.markProcessed("e1");
                tx.markProcessed("e2");
                tx.addForestEdge("e1", "e2");
                assertThat(tx.findForestSuccessor("e1")).contains("e2");
                assertThat(store.findForestSuccessor("e1")).isEmpty();
                return null;
            });

            assertThat(store.findForestEdges()).containsExactly(new ForestEdge("e1", "e2"));
            assertThat(store.findForestPredecessors("e2")).containsExactly("e1");
            assertThat(store.isProcessed("e2")).isTrue();
        }

        @Test
        @DisplayName("Nothing is applied when the work throws")
        void rollsBackOnFailure() {
            assertThatThrownBy(() -> store.inTransaction(tx -> {
                tx.markProcessed("e1");
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(store.isProcessed("e1")).isFalse();
        }

        @Test
        @DisplayName("Marking an event processed concurrently fails the later commit")
        void concurrentMark() {
            assertThatThrownBy(() -> store.inTransaction(tx -> {
                tx.markProcessed("e1");
                store.inTransaction(other -> {
                    other.markProcessed("e1");
                    return null;
                });
                return null;
            })).isInstanceOf(ConcurrentMergeException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CONCURRENT_MERGE");
        }

        @Test
        @DisplayName("Extending a head already extended elsewhere fails and applies nothing")
        void concurrentHeadExtension() {
            store.inTransaction(tx -> {
                tx.markProcessed("e1");
                return null;
            });

            assertThatThrownBy(() -> store.inTransaction(tx -> {
                tx.markProcessed("e2");
                tx.addForestEdge("e1", "e2");
                store.inTransaction(other -> {
                    other.markProcessed("e3");
                    other.addForestEdge("e1", "e3");
                    return null;
                });
                return null;
            })).isInstanceOf(TransientStoreException.class);

            assertThat(store.isProcessed("e2")).isFalse();
            assertThat(store.findForestEdges()).containsExactly(new ForestEdge("e1", "e3"));
        }

        @Test
        @DisplayName("A head cannot be extended twice within one transaction")
        void doubleExtension() {
            assertThatThrownBy(() -> store.inTransaction(tx -> {
                tx.markProcessed("e1");
                tx.markProcessed("e2");
                tx.markProcessed("e3");
                tx.addForestEdge("e1", "e2");
                tx.addForestEdge("e1", "e3");
                return null;
            })).isInstanceOf(ConcurrentMergeException.class);

            assertThat(store.stats().processedCount()).isZero();
        }
    }

    @Test
    @DisplayName("Reset clears derived state and keeps events, entities and touches")
    void resetKeepsEvents() {
        store.addPrecedenceEdge(new PrecedenceEdge("e1", "e2", CARD));
        store.inTransaction(tx -> {
            tx.markProcessed("e1");
            tx.markProcessed("e2");
            tx.addForestEdge("e1", "e2");
            return null;
        });
        store.saveMetrics("e2", new ComponentMetrics(2, 1, 1.0));

        store.reset();

        var stats = store.stats();
        assertThat(stats.eventCount()).isEqualTo(3);
        assertThat(stats.entityCount()).isEqualTo(1);
        assertThat(stats.touchCount()).isEqualTo(3);
        assertThat(stats.precedenceEdgeCount()).isZero();
        assertThat(stats.forestEdgeCount()).isZero();
        assertThat(stats.processedCount()).isZero();
        assertThat(stats.metricsCount()).isZero();
        assertThat(store.findUnprocessedEvents()).extracting(Event::id).containsExactly("e1", "e2", "e3");
    }
}
