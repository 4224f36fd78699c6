package com.temporal.wcc.service.engine;

import java.util.List;

/**
 * Structural violations found in the chains and the forest. Empty when the graph is sound.
 */
public record ValidationReport(List<Violation> violations, int entitiesChecked, int forestEdgesChecked) {

    public boolean isValid() {
        return violations.isEmpty();
    }

    public record Violation(String kind, String subject, String detail) {}
}
