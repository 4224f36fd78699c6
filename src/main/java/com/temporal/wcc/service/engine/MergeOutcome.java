package com.temporal.wcc.service.engine;

import java.util.List;

/**
 * Result of merging one event into the forest.
 *
 * @param absorbedHeads heads that now point at the event, in chronological order
 * @param skipped       true when the event was already processed
 */
public record MergeOutcome(String eventId, List<String> absorbedHeads, boolean skipped) {

    public static MergeOutcome skipped(String eventId) {
        return new MergeOutcome(eventId, List.of(), true);
    }

    public boolean isSingleton() {
        return !skipped && absorbedHeads.isEmpty();
    }
}
