package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.MetricsReport.MetricsFailure;
import com.temporal.wcc.service.model.ComponentMetrics;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.oracle.OracleUnavailableException;
import com.temporal.wcc.service.oracle.ShortestPathOracle;
import com.temporal.wcc.service.store.GraphStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes size, diameter and velocity of the component snapshot rooted at each
 * processed event.
 *
 * The snapshot of {@code s} is every event reachable from {@code s} through incoming
 * forest edges, {@code s} itself excluded. Because the forest is append-only, the
 * snapshot never changes once {@code s} is merged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComponentMetricsEngine {

    private final GraphStore graphStore;
    private final ShortestPathOracle shortestPathOracle;
    private final WccConfig wccConfig;
    private final MetricsConfig metricsConfig;

    // ==================== Public API ====================

    /**
     * Computes metrics for processed events that have none yet.
     */
    public MetricsReport computeMissing() {
        var pending = graphStore.findProcessedEvents().stream()
                .map(Event::id)
                .filter(id -> graphStore.findMetrics(id).isEmpty())
                .toList();
        return computeAll(pending);
    }

    /**
     * Recomputes metrics for every processed event.
     */
    public MetricsReport recomputeAll() {
        var all = graphStore.findProcessedEvents().stream().map(Event::id).toList();
        return computeAll(all);
    }

    /**
     * Computes and stores the metrics of one processed event.
     */
    public ComponentMetrics compute(String eventId) {
        var metrics = measure(eventId);
        graphStore.saveMetrics(eventId, metrics);
        metricsConfig.getComponentMetricsComputed().increment();
        log.debug("Metrics for {}: {}", eventId, metrics);
        return metrics;
    }

    /**
     * Computes the metrics of one processed event without storing them.
     *
     * @throws MetricsComputationException if the event is not processed or the
     *                                     shortest-path oracle fails
     */
    public ComponentMetrics measure(String eventId) {
        var root = graphStore.findEvent(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
        if (!graphStore.isProcessed(eventId)) {
            throw new MetricsComputationException(eventId, "Event " + eventId + " is not merged yet", null);
        }

        var ancestors = collectAncestors(eventId);
        if (ancestors.isEmpty()) {
            return ComponentMetrics.singleton();
        }

        var ids = ancestors.stream().map(Event::id).toList();
        var projection = MicroProjection.of(ids, graphStore::findEntities);
        return new ComponentMetrics(ancestors.size() + 1L, diameter(eventId, projection), velocity(root, ancestors));
    }

    // ==================== Snapshot ====================

    private List<Event> collectAncestors(String rootId) {
        var ancestors = new ArrayList<Event>();
        var seen = new HashSet<String>();
        seen.add(rootId);
        var queue = new ArrayDeque<String>(graphStore.findForestPredecessors(rootId));
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            ancestors.add(graphStore.findEvent(current).orElseThrow(() -> new EventNotFoundException(current)));
            queue.addAll(graphStore.findForestPredecessors(current));
        }
        return ancestors;
    }

    /**
     * Largest event-to-event distance in the projection, halved since every hop between
     * two events passes through an entity. Pairs in different parts of the projection
     * are not connected and are ignored.
     */
    private Integer diameter(String rootId, MicroProjection projection) {
        if (projection.touchEdgeCount() == 0) {
            return null;
        }
        int longest = 0;
        for (var source : projection.eventNodes()) {
            try {
                for (var entry : shortestPathOracle.shortestPathLengths(projection, source).entrySet()) {
                    if (MicroProjection.isEventNode(entry.getKey())) {
                        longest = Math.max(longest, entry.getValue());
                    }
                }
            } catch (OracleUnavailableException e) {
                throw new MetricsComputationException(rootId,
                        "Shortest paths unavailable for component of " + rootId, e);
            }
        }
        return longest / 2;
    }

    private double velocity(Event root, List<Event> ancestors) {
        var earliest = ancestors.stream().min(Event.CHRONOLOGICAL).orElseThrow();
        double spanSeconds = Duration.between(earliest.timestamp(), root.timestamp()).toMillis() / 1000.0;
        return spanSeconds > 0 ? ancestors.size() / spanSeconds : 0.0;
    }

    // ==================== Batching ====================

    private MetricsReport computeAll(List<String> eventIds) {
        if (eventIds.isEmpty()) {
            return MetricsReport.empty();
        }
        var sample = Timer.start(metricsConfig.getRegistry());
        long startedAt = System.currentTimeMillis();

        var batches = partition(eventIds, Math.max(1, wccConfig.getMetrics().getBatchSize()));
        int parallelism = Math.max(1, Math.min(wccConfig.getMetrics().resolveParallelism(), batches.size()));
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, threadFactory());
        try {
            var futures = batches.stream()
                    .map(batch -> CompletableFuture.supplyAsync(() -> computeBatch(batch), pool))
                    .toList();
            int computed = 0;
            var failures = new ArrayList<MetricsFailure>();
            for (var future : futures) {
                var partial = future.join();
                computed += partial.computed();
                failures.addAll(partial.failures());
            }
            var report = new MetricsReport(computed, List.copyOf(failures), System.currentTimeMillis() - startedAt);
            logReport(report);
            return report;
        } finally {
            pool.shutdownNow();
            sample.stop(metricsConfig.getMetricsTimer());
        }
    }

    private MetricsReport computeBatch(List<String> batch) {
        int computed = 0;
        var failures = new ArrayList<MetricsFailure>();
        for (var eventId : batch) {
            try {
                compute(eventId);
                computed++;
            } catch (ForestException e) {
                log.error("Metrics failed for {}: {}", eventId, e.getMessage());
                failures.add(new MetricsFailure(eventId, e.getErrorCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Unexpected metrics failure for {}", eventId, e);
                failures.add(new MetricsFailure(eventId, "METRICS_FAILED", e.getMessage()));
            }
        }
        return new MetricsReport(computed, failures, 0);
    }

    private static List<List<String>> partition(List<String> ids, int size) {
        var batches = new ArrayList<List<String>>();
        for (int from = 0; from < ids.size(); from += size) {
            batches.add(ids.subList(from, Math.min(ids.size(), from + size)));
        }
        return batches;
    }

    private static ThreadFactory threadFactory() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "component-metrics-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void logReport(MetricsReport report) {
        if (report.isSuccessful()) {
            log.info("Component metrics computed for {} events in {} ms", report.computed(), report.durationMs());
        } else {
            log.warn("Component metrics computed for {} events, {} failed",
                    report.computed(), report.failures().size());
        }
    }
}
