package com.temporal.wcc.service.engine;

import java.util.List;

/**
 * Summary of a component metrics pass.
 */
public record MetricsReport(int computed, List<MetricsFailure> failures, long durationMs) {

    public static MetricsReport empty() {
        return new MetricsReport(0, List.of(), 0);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public record MetricsFailure(String eventId, String errorCode, String reason) {}
}
