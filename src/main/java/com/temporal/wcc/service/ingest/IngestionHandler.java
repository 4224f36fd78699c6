package com.temporal.wcc.service.ingest;

/**
 * Handles one kind of ingestion work item.
 *
 * @param <T> the type of work item this handler processes
 */
public interface IngestionHandler<T extends IngestionWorkItem> {

    /**
     * @throws IngestionException if processing fails
     */
    void handle(T workItem);

    Class<T> getSupportedType();
}
