package com.temporal.wcc.service.ingest;

import com.temporal.wcc.service.ingest.IngestionWorkItem.EventBatchWorkItem;

import java.util.Optional;

/**
 * Bounded queue of event batches between the ingest endpoint and the ingestion workers.
 */
public interface IngestionQueue {

    /**
     * Offers a batch, waiting up to the timeout for space.
     *
     * @return true if enqueued, false if the queue stayed full
     */
    boolean enqueue(EventBatchWorkItem batch, long timeoutMs);

    /**
     * Takes the oldest batch, waiting up to the timeout.
     */
    Optional<EventBatchWorkItem> dequeue(long timeoutMs);

    /**
     * Number of queued batches.
     */
    int size();

    int getCapacity();

    /**
     * Events waiting in queued batches, not yet stored.
     */
    long getQueuedEventCount();

    /**
     * Batch utilization as a percentage (0-100).
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }
}
