package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.engine.BatchReport.GroupFailure;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.oracle.ComponentLabelOracle;
import com.temporal.wcc.service.oracle.ComponentLabelOracle.Link;
import com.temporal.wcc.service.oracle.OracleUnavailableException;
import com.temporal.wcc.service.store.GraphStore;
import com.temporal.wcc.service.store.TransientStoreException;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Merges all unprocessed events, one transaction per component group.
 *
 * Groups come from a component labelling of the planning graph, so two groups never
 * extend the same head. Groups run concurrently on a bounded pool; a group that loses
 * an optimistic check at commit is retried as a whole.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchCoordinator {

    static final String SEQUENTIAL_LABEL = "sequential";

    private final GraphStore graphStore;
    private final TemporalUnionFindForest forest;
    private final ComponentLabelOracle labelOracle;
    private final WccConfig wccConfig;
    private final MetricsConfig metricsConfig;

    // ==================== Public API ====================

    /**
     * Plans, shuffles and merges every unprocessed event.
     */
    public BatchReport runBatch() {
        var sample = Timer.start(metricsConfig.getRegistry());
        long startedAt = System.currentTimeMillis();
        try {
            var unprocessed = graphStore.findUnprocessedEvents();
            if (unprocessed.isEmpty()) {
                log.debug("No unprocessed events, nothing to merge");
                return BatchReport.empty();
            }
            var plan = planGroups(unprocessed);
            var groups = new ArrayList<>(plan.groups());
            Collections.shuffle(groups, shuffleRandom());
            var report = dispatch(groups, plan.degraded(), startedAt);
            logReport(report, unprocessed.size());
            return report;
        } finally {
            sample.stop(metricsConfig.getBatchTimer());
        }
    }

    /**
     * Merges the given events as one group, retrying transient failures. Used to
     * retry a group reported in {@link BatchReport#failures()}.
     */
    public BatchReport retry(String label, Collection<String> eventIds) {
        long startedAt = System.currentTimeMillis();
        var events = eventIds.stream()
                .distinct()
                .map(id -> graphStore.findEvent(id).orElseThrow(() -> new EventNotFoundException(id)))
                .toList();
        var report = dispatch(List.of(new MergeGroup(label, events)), false, startedAt);
        logReport(report, events.size());
        return report;
    }

    /**
     * Merges one group in a single store transaction, without retry.
     *
     * @return number of events merged (already processed events are skipped)
     * @throws TransientStoreException      if the commit lost an optimistic check
     * @throws StructuralViolationException if the forest is corrupt
     */
    public int mergeGroup(MergeGroup group) {
        return metricsConfig.getGroupMergeTimer().record(() -> graphStore.inTransaction(tx -> {
            int merged = 0;
            for (var event : group.events()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Merge of group " + group.label() + " cancelled");
                }
                if (!forest.merge(tx, event).skipped()) {
                    merged++;
                }
            }
            return merged;
        }));
    }

    // ==================== Planning ====================

    record Plan(List<MergeGroup> groups, boolean degraded) {}

    /**
     * Labels the planning graph: unprocessed events, their precedence links among
     * themselves, and a link to the current head of every processed predecessor.
     */
    Plan planGroups(List<Event> unprocessed) {
        var ids = new LinkedHashSet<String>();
        unprocessed.forEach(event -> ids.add(event.id()));

        var nodes = new LinkedHashSet<>(ids);
        var links = new ArrayList<Link>();
        for (var event : unprocessed) {
            for (var predecessor : graphStore.findPrecedencePredecessors(event.id())) {
                if (ids.contains(predecessor)) {
                    links.add(new Link(predecessor, event.id()));
                } else if (graphStore.isProcessed(predecessor)) {
                    var anchor = plannedHead(predecessor);
                    nodes.add(anchor);
                    links.add(new Link(anchor, event.id()));
                }
            }
        }

        Map<String, String> labels;
        try {
            labels = labelOracle.label(nodes, links);
        } catch (OracleUnavailableException e) {
            log.warn("Component labelling unavailable, merging {} events sequentially: {}",
                    unprocessed.size(), e.getMessage());
            return sequentialPlan(unprocessed);
        }

        var grouped = new LinkedHashMap<String, List<Event>>();
        for (var event : unprocessed) {
            var label = labels.get(event.id());
            if (label == null) {
                log.warn("No component label for event {}, merging {} events sequentially",
                        event.id(), unprocessed.size());
                return sequentialPlan(unprocessed);
            }
            grouped.computeIfAbsent(label, k -> new ArrayList<>()).add(event);
        }

        var groups = grouped.entrySet().stream()
                .map(entry -> new MergeGroup(entry.getKey(), entry.getValue()))
                .toList();
        log.debug("Planned {} groups for {} unprocessed events", groups.size(), unprocessed.size());
        return new Plan(groups, false);
    }

    /**
     * Current head of a processed predecessor. A corrupt walk anchors the event on the
     * predecessor itself; the merge of that group then reports the violation.
     */
    private String plannedHead(String predecessor) {
        try {
            return forest.findHead(graphStore, predecessor);
        } catch (StructuralViolationException e) {
            log.error("Cannot resolve head of {} while planning: {}", predecessor, e.getMessage());
            return predecessor;
        }
    }

    private Plan sequentialPlan(List<Event> unprocessed) {
        return new Plan(List.of(new MergeGroup(SEQUENTIAL_LABEL, unprocessed)), true);
    }

    private Random shuffleRandom() {
        var seed = wccConfig.getBatch().getShuffleSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    // ==================== Dispatch ====================

    private BatchReport dispatch(List<MergeGroup> groups, boolean degraded, long startedAt) {
        int parallelism = Math.min(wccConfig.getBatch().resolveParallelism(), groups.size());
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory());
        try {
            var futures = groups.stream()
                    .map(group -> CompletableFuture.supplyAsync(() -> mergeWithRetry(group), pool))
                    .toList();
            var results = futures.stream().map(CompletableFuture::join).toList();
            return summarize(groups.size(), results, degraded, startedAt);
        } finally {
            pool.shutdownNow();
        }
    }

    private GroupResult mergeWithRetry(MergeGroup group) {
        var batch = wccConfig.getBatch();
        long backoff = batch.getBackoffMs();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                int merged = mergeGroup(group);
                metricsConfig.getEventsMerged().increment(merged);
                return GroupResult.success(merged);
            } catch (StructuralViolationException e) {
                log.error("Structural violation in group {}, not retrying", group.label(), e);
                return GroupResult.failure(group, attempt, e.getErrorCode(), e.getMessage(), true);
            } catch (TransientStoreException e) {
                if (attempt >= batch.getMaxAttempts()) {
                    log.error("Group {} failed after {} attempts: {}", group.label(), attempt, e.getMessage());
                    return GroupResult.failure(group, attempt, e.getErrorCode(), e.getMessage(), false);
                }
                metricsConfig.getGroupRetries().increment();
                log.warn("Transient failure in group {} (attempt {}/{}), retrying in {} ms: {}",
                        group.label(), attempt, batch.getMaxAttempts(), backoff, e.getMessage());
                if (!sleep(backoff)) {
                    return GroupResult.failure(group, attempt, "CANCELLED", "Interrupted during backoff", false);
                }
                backoff = Math.min(backoff * 2, batch.getMaxBackoffMs());
            } catch (CancellationException e) {
                log.warn("Group {} cancelled before commit", group.label());
                return GroupResult.failure(group, attempt, "CANCELLED", e.getMessage(), false);
            } catch (ForestException e) {
                log.error("Group {} failed: {}", group.label(), e.getMessage(), e);
                return GroupResult.failure(group, attempt, e.getErrorCode(), e.getMessage(), false);
            } catch (RuntimeException e) {
                log.error("Unexpected failure in group {}", group.label(), e);
                return GroupResult.failure(group, attempt, "MERGE_FAILED", e.getMessage(), false);
            }
        }
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private BatchReport summarize(int planned, List<GroupResult> results, boolean degraded, long startedAt) {
        int succeeded = 0;
        int merged = 0;
        var failures = new ArrayList<GroupFailure>();
        for (var result : results) {
            if (result.failure() == null) {
                succeeded++;
                merged += result.merged();
            } else {
                failures.add(result.failure());
                metricsConfig.getGroupFailures().increment();
            }
        }
        return new BatchReport(planned, succeeded, merged, degraded, List.copyOf(failures),
                System.currentTimeMillis() - startedAt);
    }

    private static ThreadFactory threadFactory() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "merge-group-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ==================== Logging ====================

    private void logReport(BatchReport report, int eventCount) {
        if (report.isSuccessful()) {
            log.info("Batch merge completed: {} events, {} groups, {} merged in {} ms",
                    eventCount, report.groupsPlanned(), report.eventsMerged(), report.durationMs());
        } else {
            log.warn("Batch merge completed with {} failed group(s): {} of {} groups committed, {} merged",
                    report.failures().size(), report.groupsSucceeded(), report.groupsPlanned(),
                    report.eventsMerged());
        }
    }

    private record GroupResult(int merged, GroupFailure failure) {

        static GroupResult success(int merged) {
            return new GroupResult(merged, null);
        }

        static GroupResult failure(MergeGroup group, int attempts, String code, String reason, boolean fatal) {
            return new GroupResult(0, new GroupFailure(group.label(), group.eventIds(), attempts, code, reason, fatal));
        }
    }
}
