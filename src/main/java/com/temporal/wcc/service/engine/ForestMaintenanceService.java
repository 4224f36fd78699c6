package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.WccConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Incremental merge of newly ingested events, followed by their metrics.
 *
 * Triggers that arrive while a pass is running are coalesced into one more pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForestMaintenanceService {

    private final BatchCoordinator batchCoordinator;
    private final ComponentMetricsEngine metricsEngine;
    private final ForestRebuildService rebuildService;
    private final WccConfig wccConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean pending = new AtomicBoolean(false);

    /**
     * Requests a merge pass on the merge executor.
     */
    @Async("mergeExecutor")
    public void triggerMerge() {
        try {
            mergePending();
        } catch (Exception e) {
            log.error("Async merge failed", e);
        }
    }

    /**
     * Background sweep for events left unprocessed by failed groups or lost triggers.
     */
    @Scheduled(fixedDelayString = "${wcc.features.merge-sweep-ms:60000}")
    public void sweep() {
        if (wccConfig.getFeatures().isAutoMergeEnabled()) {
            mergePending();
        }
    }

    /**
     * Merges pending events, or marks another pass as needed if one is already running.
     *
     * @return true if this call ran at least one pass
     */
    public boolean mergePending() {
        pending.set(true);
        boolean ran = false;
        do {
            if (!running.compareAndSet(false, true)) {
                log.debug("Merge pass already running, request coalesced");
                return ran;
            }
            try {
                while (pending.getAndSet(false)) {
                    runPass();
                    ran = true;
                }
            } finally {
                running.set(false);
            }
        } while (pending.get());
        return ran;
    }

    private void runPass() {
        rebuildService.exclusively(() -> {
            var batch = batchCoordinator.runBatch();
            if (batch.eventsMerged() > 0 && wccConfig.getFeatures().isMetricsAfterMergeEnabled()) {
                metricsEngine.computeMissing();
            }
            return batch;
        });
    }
}
