package com.temporal.wcc.service.engine;

/**
 * Outcome of a chain-building pass.
 *
 * @param lateArrivals new edges pointing into an already processed event; those
 *                     components need a rebuild to reflect the late event exactly
 */
public record ChainLinkResult(
        int entitiesScanned,
        int edgesCreated,
        int edgesRemoved,
        int lateArrivals
) {

    public static ChainLinkResult empty() {
        return new ChainLinkResult(0, 0, 0, 0);
    }

    public ChainLinkResult plus(ChainLinkResult other) {
        return new ChainLinkResult(
                entitiesScanned + other.entitiesScanned,
                edgesCreated + other.edgesCreated,
                edgesRemoved + other.edgesRemoved,
                lateArrivals + other.lateArrivals
        );
    }
}
