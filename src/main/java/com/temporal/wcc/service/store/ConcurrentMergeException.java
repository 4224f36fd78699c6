package com.temporal.wcc.service.store;

/**
 * An optimistic merge check failed at commit: a head was extended by someone else,
 * or the event was already processed by a concurrent run.
 */
public class ConcurrentMergeException extends TransientStoreException {

    public ConcurrentMergeException(String message, String eventId) {
        super(message, eventId, "CONCURRENT_MERGE");
    }
}
