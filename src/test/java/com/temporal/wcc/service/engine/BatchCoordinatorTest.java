package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.oracle.BreadthFirstComponentLabelOracle;
import com.temporal.wcc.service.oracle.BreadthFirstShortestPathOracle;
import com.temporal.wcc.service.oracle.OracleUnavailableException;
import com.temporal.wcc.service.store.ForestTransaction;
import com.temporal.wcc.service.store.InMemoryGraphStore;
import com.temporal.wcc.service.store.TransientStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.temporal.wcc.service.engine.ForestFixture.card;
import static com.temporal.wcc.service.engine.ForestFixture.device;
import static org.assertj.core.api.Assertions.assertThat;

class BatchCoordinatorTest {

    @Test
    @DisplayName("Independent components are planned as separate groups")
    void groupsFollowComponents() {
        var fixture = new ForestFixture();
        fixture.linearChain();
        fixture.cardChain();
        fixture.event("solo", 50, card("solo"));
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();

        assertThat(report.groupsPlanned()).isEqualTo(3);
        assertThat(report.groupsSucceeded()).isEqualTo(3);
        assertThat(report.eventsMerged()).isEqualTo(8);
        assertThat(report.degraded()).isFalse();
        assertThat(fixture.store.findUnprocessedEvents()).isEmpty();
    }

    @Test
    @DisplayName("New events extending the same head land in one group")
    void eventsSharingAHeadAreGroupedTogether() {
        var fixture = new ForestFixture();
        fixture.event("h", 0, card("one"), device("two"));
        fixture.process();
        fixture.event("n1", 10, card("one"));
        fixture.event("n2", 20, device("two"));
        fixture.chainBuilder.linkAll();

        var plan = fixture.coordinator.planGroups(fixture.store.findUnprocessedEvents());

        assertThat(plan.groups()).hasSize(1);
        assertThat(plan.groups().get(0).eventIds()).containsExactly("n1", "n2");
    }

    @Test
    @DisplayName("Running a batch twice merges nothing the second time")
    void batchIsIdempotent() {
        var fixture = new ForestFixture();
        fixture.linearChain();
        fixture.chainBuilder.linkAll();
        fixture.coordinator.runBatch();
        var edges = new HashSet<>(fixture.store.findForestEdges());

        var second = fixture.coordinator.runBatch();

        assertThat(second.eventsMerged()).isZero();
        assertThat(new HashSet<>(fixture.store.findForestEdges())).isEqualTo(edges);
    }

    @Test
    @DisplayName("Many independent components merge concurrently without interference")
    void concurrentIndependentComponents() {
        var fixture = new ForestFixture();
        for (int c = 0; c < 25; c++) {
            for (int i = 0; i < 6; i++) {
                fixture.event("c" + c + "-" + i, c + i * 60L, card("card-" + c));
            }
        }
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();
        fixture.metricsEngine.computeMissing();

        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.groupsPlanned()).isEqualTo(25);
        assertThat(report.eventsMerged()).isEqualTo(150);
        assertThat(fixture.validator.validate().isValid()).isTrue();
        for (int c = 0; c < 25; c++) {
            assertThat(fixture.forest.findHead(fixture.store, "c" + c + "-0")).isEqualTo("c" + c + "-5");
            assertThat(fixture.store.findMetrics("c" + c + "-5").orElseThrow().componentSize()).isEqualTo(6);
        }
    }

    @Test
    @DisplayName("Conflicting merges of one component commit exactly once")
    void conflictingMergesYieldOneOutcome() {
        var fixture = new ForestFixture();
        fixture.config.getBatch().setMaxAttempts(10);
        fixture.linearChain();
        fixture.chainBuilder.linkAll();
        var ids = List.of("a1", "a2", "a3", "a4");

        var first = CompletableFuture.supplyAsync(() -> fixture.coordinator.retry("first", ids));
        var second = CompletableFuture.supplyAsync(() -> fixture.coordinator.retry("second", ids));
        var reports = List.of(first.join(), second.join());

        assertThat(reports).allMatch(BatchReport::isSuccessful);
        assertThat(reports.get(0).eventsMerged() + reports.get(1).eventsMerged()).isEqualTo(4);
        assertThat(fixture.store.findForestEdges()).hasSize(3);
        assertThat(fixture.forest.findHead(fixture.store, "a1")).isEqualTo("a4");
        assertThat(fixture.validator.validate().isValid()).isTrue();
    }

    @Test
    @DisplayName("Transient failures are retried with the whole group")
    void transientFailuresRetried() {
        var store = new FlakyStore(2);
        var fixture = new ForestFixture(store, new BreadthFirstComponentLabelOracle(),
                new BreadthFirstShortestPathOracle());
        fixture.linearChain();
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();

        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.eventsMerged()).isEqualTo(4);
        assertThat(fixture.metrics.getGroupRetries().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("A group failing every attempt is reported and can be retried later")
    void exhaustedGroupReportedForRetry() {
        var store = new FlakyStore(5);
        var fixture = new ForestFixture(store, new BreadthFirstComponentLabelOracle(),
                new BreadthFirstShortestPathOracle());
        fixture.linearChain();
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();

        assertThat(report.failures()).hasSize(1);
        var failure = report.failures().get(0);
        assertThat(failure.fatal()).isFalse();
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.eventIds()).containsExactly("a1", "a2", "a3", "a4");
        assertThat(fixture.store.stats().processedCount()).isZero();

        var retried = fixture.coordinator.retry(failure.label(), failure.eventIds());

        assertThat(retried.isSuccessful()).isTrue();
        assertThat(retried.eventsMerged()).isEqualTo(4);
    }

    @Test
    @DisplayName("Structural violations fail their group without retry; other groups commit")
    void structuralViolationIsFatal() {
        var fixture = new ForestFixture();
        fixture.event("p", 0, card("broken"));
        fixture.event("q", 1);
        fixture.store.inTransaction(tx -> {
            tx.markProcessed("p");
            tx.markProcessed("q");
            tx.addForestEdge("p", "q");
            tx.addForestEdge("q", "p");
            return null;
        });
        fixture.event("r", 10, card("broken"));
        fixture.cardChain();
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();

        assertThat(report.failures()).hasSize(1);
        var failure = report.failures().get(0);
        assertThat(failure.fatal()).isTrue();
        assertThat(failure.attempts()).isEqualTo(1);
        assertThat(failure.errorCode()).isEqualTo("STRUCTURAL_VIOLATION");
        assertThat(failure.eventIds()).containsExactly("r");
        assertThat(fixture.store.isProcessed("b3")).isTrue();
        assertThat(fixture.store.isProcessed("r")).isFalse();
    }

    @Test
    @DisplayName("A late arrival fails its group fatally and is placed by the rebuild")
    void lateArrivalWaitsForRebuild() {
        var fixture = new ForestFixture();
        var ip = ForestFixture.ip("10.0.0.7");
        fixture.event("a1", 0, ip);
        fixture.event("a2", 20, ip);
        fixture.process();
        fixture.event("l", 10, ip);

        var report = fixture.process();

        assertThat(report.failures()).hasSize(1);
        var failure = report.failures().get(0);
        assertThat(failure.fatal()).isTrue();
        assertThat(failure.errorCode()).isEqualTo("STRUCTURAL_VIOLATION");
        assertThat(failure.eventIds()).containsExactly("l");
        assertThat(fixture.store.isProcessed("l")).isFalse();
        assertThat(fixture.store.findForestEdges()).containsExactly(new ForestEdge("a1", "a2"));
        assertThat(fixture.validator.validate().isValid()).isTrue();

        fixture.rebuildService.rebuild();

        assertThat(fixture.store.findForestEdges()).containsExactlyInAnyOrder(
                new ForestEdge("a1", "l"), new ForestEdge("l", "a2"));
        assertThat(fixture.validator.validate().isValid()).isTrue();
    }

    @Test
    @DisplayName("Without the labelling oracle everything merges in one sequential group")
    void oracleUnavailableFallsBackToSequential() {
        var fixture = new ForestFixture(null, (nodes, links) -> {
            throw new OracleUnavailableException("wcc", "connection refused");
        }, new BreadthFirstShortestPathOracle());
        fixture.linearChain();
        fixture.cardChain();
        fixture.chainBuilder.linkAll();

        var report = fixture.coordinator.runBatch();

        assertThat(report.degraded()).isTrue();
        assertThat(report.groupsPlanned()).isEqualTo(1);
        assertThat(report.eventsMerged()).isEqualTo(7);

        var reference = new ForestFixture();
        reference.linearChain();
        reference.cardChain();
        reference.chainBuilder.linkAll();
        reference.coordinator.runBatch();
        assertThat(new HashSet<>(fixture.store.findForestEdges()))
                .isEqualTo(new HashSet<>(reference.store.findForestEdges()));
    }

    /**
     * Fails the first {@code failures} transactions with a transient error.
     */
    private static class FlakyStore extends InMemoryGraphStore {

        private final AtomicInteger failures;

        FlakyStore(int failures) {
            super(new MetricsConfig(new SimpleMeterRegistry()));
            this.failures = new AtomicInteger(failures);
        }

        @Override
        public <T> T inTransaction(Function<ForestTransaction, T> work) {
            if (failures.getAndDecrement() > 0) {
                throw new TransientStoreException("simulated lock timeout", null, null);
            }
            return super.inTransaction(work);
        }
    }
}
