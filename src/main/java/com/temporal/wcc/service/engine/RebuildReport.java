package com.temporal.wcc.service.engine;

/**
 * Outcome of a full rebuild of the derived graph.
 */
public record RebuildReport(ChainLinkResult chains, BatchReport batch, MetricsReport metrics) {

    public boolean isSuccessful() {
        return batch.isSuccessful() && metrics.isSuccessful();
    }
}
