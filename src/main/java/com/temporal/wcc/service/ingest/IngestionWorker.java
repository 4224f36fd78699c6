package com.temporal.wcc.service.ingest;

import com.temporal.wcc.service.config.IngestionConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker service that drains the ingestion queue on a fixed pool of platform threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionWorker {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final IngestionQueue queue;
    private final IngestionHandler<IngestionWorkItem.EventBatchWorkItem> eventBatchHandler;
    private final IngestionConfig ingestionConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = ingestionConfig.getWorker().getThreadCount();
        executorService = Executors.newFixedThreadPool(workerCount, this::createWorkerThread);
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::processLoop);
        }
        log.info("IngestionWorker started with {} worker threads", workerCount);
    }

    @PreDestroy
    void stop() {
        running.set(false);
        shutdownExecutor();
        log.info("IngestionWorker stopped. Final active workers: {}", activeWorkers.get());
    }

    // ==================== Executor Management ====================

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("ingestion-worker-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of ingestion workers");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        activeWorkers.incrementAndGet();
        var pollTimeoutMs = ingestionConfig.getTimeout().getPollMs();

        try {
            while (running.get()) {
                processNextItem(pollTimeoutMs);
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void processNextItem(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs)
                    .ifPresent(this::processWorkItem);
        } catch (Exception e) {
            log.error("Error in ingestion worker loop", e);
        }
    }

    // ==================== Batch Handling ====================

    private void processWorkItem(IngestionWorkItem.EventBatchWorkItem batch) {
        try {
            eventBatchHandler.handle(batch);
        } catch (IngestionException e) {
            log.error("Ingestion failed for batch {}: {} [{}]",
                    batch.batchId(), e.getMessage(), e.getErrorCode());
        } catch (Exception e) {
            log.error("Unexpected error processing batch {}", batch.batchId(), e);
        }
    }

    // ==================== Monitoring ====================

    /**
     * Returns the current number of active workers.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }
}
