package com.temporal.wcc.service.ingest;

import com.temporal.wcc.service.config.IngestionConfig;
import com.temporal.wcc.service.config.MetricsConfig;
import com.temporal.wcc.service.ingest.IngestionWorkItem.EventBatchWorkItem;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event batch queue with a bounded number of batches.
 *
 * Keeps a running count of the events inside queued batches, so the event backlog is
 * visible separately from the batch count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultIngestionQueue implements IngestionQueue {

    private final IngestionConfig config;
    private final MetricsConfig metricsConfig;

    private final AtomicLong queuedEvents = new AtomicLong();
    private BlockingQueue<EventBatchWorkItem> batches;
    private int capacity;

    @PostConstruct
    void init() {
        capacity = config.getQueue().getCapacity();
        batches = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerQueueGauge("wcc.ingest.queue.batches", "Event batches waiting for a worker", this::size);
        metricsConfig.registerQueueGauge("wcc.ingest.queue.events", "Events inside queued batches", queuedEvents::get);
        metricsConfig.registerQueueGauge("wcc.ingest.queue.utilization", "Batch queue utilization percentage",
                this::getUtilizationPercent);

        log.info("Event batch queue ready: capacity={} batches", capacity);
    }

    @Override
    public boolean enqueue(EventBatchWorkItem batch, long timeoutMs) {
        int eventCount = batch.events().size();
        try {
            if (!batches.offer(batch, timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Batch {} with {} events rejected, {} events already waiting",
                        batch.batchId(), eventCount, queuedEvents.get());
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing batch {}", batch.batchId());
            return false;
        }
        queuedEvents.addAndGet(eventCount);
        log.debug("Queued batch {} ({} events)", batch.batchId(), eventCount);
        return true;
    }

    @Override
    public Optional<EventBatchWorkItem> dequeue(long timeoutMs) {
        EventBatchWorkItem batch;
        try {
            batch = batches.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (batch == null) {
            return Optional.empty();
        }
        queuedEvents.addAndGet(-batch.events().size());
        log.debug("Batch {} waited {} ms", batch.batchId(),
                Duration.between(batch.createdAt(), Instant.now()).toMillis());
        return Optional.of(batch);
    }

    @Override
    public int size() {
        return batches.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public long getQueuedEventCount() {
        return queuedEvents.get();
    }
}
