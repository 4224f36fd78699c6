package com.temporal.wcc.service.ingest;

import java.time.Instant;
import java.util.List;

/**
 * Sealed interface for ingestion work items.
 *
 * Closed hierarchy of the item types the ingestion pipeline can process.
 */
public sealed interface IngestionWorkItem permits IngestionWorkItem.EventBatchWorkItem {

    /**
     * Gets the id used to trace this work item in logs.
     */
    String getEntityId();

    /**
     * Gets the timestamp when this item was created.
     */
    Instant getCreatedAt();

    /**
     * A batch of events with their touched entities.
     */
    record EventBatchWorkItem(
            String batchId,
            List<IncomingEvent> events,
            Instant createdAt
    ) implements IngestionWorkItem {

        public EventBatchWorkItem(String batchId, List<IncomingEvent> events) {
            this(batchId, List.copyOf(events), Instant.now());
        }

        @Override
        public String getEntityId() {
            return batchId;
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }
    }
}
