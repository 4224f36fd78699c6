package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reset and cold rebuild of everything derived from events and touch edges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForestRebuildService {

    private final GraphStore graphStore;
    private final SequentialChainBuilder chainBuilder;
    private final BatchCoordinator batchCoordinator;
    private final ComponentMetricsEngine metricsEngine;

    private final ReentrantLock maintenanceLock = new ReentrantLock();

    /**
     * Drops precedence edges, forest edges, processed flags and metrics in one step.
     */
    public void reset() {
        exclusively(() -> {
            log.info("Resetting derived forest state");
            graphStore.reset();
            return null;
        });
    }

    /**
     * Rebuilds chains, forest and metrics from scratch. The same input always
     * rebuilds the same forest.
     */
    public RebuildReport rebuild() {
        return exclusively(this::resetAndRebuild);
    }

    /**
     * Runs work that must not overlap a reset or a rebuild.
     */
    public <T> T exclusively(Supplier<T> work) {
        maintenanceLock.lock();
        try {
            return work.get();
        } finally {
            maintenanceLock.unlock();
        }
    }

    private RebuildReport resetAndRebuild() {
        log.info("Starting forest rebuild");
        reset();
        var chains = chainBuilder.linkAll();
        var batch = batchCoordinator.runBatch();
        var metrics = metricsEngine.recomputeAll();
        var report = new RebuildReport(chains, batch, metrics);
        if (report.isSuccessful()) {
            log.info("Forest rebuilt: {} precedence edges, {} events merged, {} metrics",
                    chains.edgesCreated(), batch.eventsMerged(), metrics.computed());
        } else {
            log.warn("Forest rebuild incomplete: {} failed group(s), {} failed metric(s)",
                    batch.failures().size(), metrics.failures().size());
        }
        return report;
    }
}
