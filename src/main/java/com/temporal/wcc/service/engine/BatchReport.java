package com.temporal.wcc.service.engine;

import java.util.List;

/**
 * Summary of one batch merge run.
 *
 * @param degraded true when grouping fell back to one sequential group
 * @param failures groups that did not commit; each carries enough to retry it
 */
public record BatchReport(
        int groupsPlanned,
        int groupsSucceeded,
        int eventsMerged,
        boolean degraded,
        List<GroupFailure> failures,
        long durationMs
) {

    public static BatchReport empty() {
        return new BatchReport(0, 0, 0, false, List.of(), 0);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * A group whose transaction was not committed.
     *
     * @param fatal true for structural violations, which are never retried
     */
    public record GroupFailure(
            String label,
            List<String> eventIds,
            int attempts,
            String errorCode,
            String reason,
            boolean fatal
    ) {}
}
