package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.engine.ValidationReport.Violation;
import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.model.ForestEdge;
import com.temporal.wcc.service.model.PrecedenceEdge;
import com.temporal.wcc.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full scan of the derived graph for broken chains and a malformed forest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForestValidator {

    static final String CHAIN = "CHAIN_NOT_LINEAR";
    static final String BRANCHING = "FOREST_BRANCHING";
    static final String CYCLE = "FOREST_CYCLE";
    static final String BACKWARD = "FOREST_BACKWARD_IN_TIME";
    static final String UNPROCESSED = "FOREST_UNPROCESSED_ENDPOINT";

    private final GraphStore graphStore;

    public ValidationReport validate() {
        var violations = new ArrayList<Violation>();

        var entities = graphStore.findAllEntities();
        for (var entity : entities) {
            checkChain(entity, violations);
        }

        var edges = graphStore.findForestEdges();
        checkForest(edges, violations);

        var report = new ValidationReport(List.copyOf(violations), entities.size(), edges.size());
        if (report.isValid()) {
            log.info("Forest valid: {} entities, {} forest edges", entities.size(), edges.size());
        } else {
            log.warn("Forest invalid: {} violation(s)", violations.size());
        }
        return report;
    }

    public ValidationReport validateOrThrow() {
        var report = validate();
        if (!report.isValid()) {
            var first = report.violations().get(0);
            throw new StructuralViolationException(
                    report.violations().size() + " structural violation(s), first: " + first.detail(),
                    first.subject());
        }
        return report;
    }

    // ==================== Chains ====================

    private void checkChain(Entity entity, List<Violation> violations) {
        var ordered = graphStore.findEventsTouching(entity).stream()
                .distinct()
                .sorted(Event.CHRONOLOGICAL)
                .toList();
        var expected = new LinkedHashSet<PrecedenceEdge>();
        for (int i = 1; i < ordered.size(); i++) {
            expected.add(new PrecedenceEdge(ordered.get(i - 1).id(), ordered.get(i).id(), entity));
        }
        var actual = new HashSet<>(graphStore.findPrecedenceEdges(entity));
        if (!actual.equals(expected)) {
            violations.add(new Violation(CHAIN, entity.toString(),
                    "Chain of " + entity + " has " + actual.size() + " edge(s), expected the "
                            + expected.size() + " consecutive pair(s) of its events"));
        }
    }

    // ==================== Forest ====================

    private void checkForest(List<ForestEdge> edges, List<Violation> violations) {
        var successors = new HashMap<String, String>();
        for (var edge : edges) {
            var previous = successors.putIfAbsent(edge.headId(), edge.eventId());
            if (previous != null) {
                violations.add(new Violation(BRANCHING, edge.headId(),
                        "Node " + edge.headId() + " points at both " + previous + " and " + edge.eventId()));
            }
            checkEdge(edge, violations);
        }
        checkAcyclic(successors, violations);
    }

    private void checkEdge(ForestEdge edge, List<Violation> violations) {
        var head = graphStore.findEvent(edge.headId());
        var event = graphStore.findEvent(edge.eventId());
        if (head.isEmpty() || event.isEmpty()) {
            return;
        }
        if (!head.get().isBefore(event.get())) {
            violations.add(new Violation(BACKWARD, edge.headId(),
                    "Edge " + edge.headId() + " -> " + edge.eventId() + " does not point forward in time"));
        }
        if (!graphStore.isProcessed(edge.headId()) || !graphStore.isProcessed(edge.eventId())) {
            violations.add(new Violation(UNPROCESSED, edge.eventId(),
                    "Edge " + edge.headId() + " -> " + edge.eventId() + " touches an unprocessed event"));
        }
    }

    private void checkAcyclic(Map<String, String> successors, List<Violation> violations) {
        Set<String> cleared = new HashSet<>();
        for (var start : successors.keySet()) {
            var path = new LinkedHashSet<String>();
            String current = start;
            while (current != null && !cleared.contains(current)) {
                if (!path.add(current)) {
                    violations.add(new Violation(CYCLE, current, "Forest cycle through " + current));
                    break;
                }
                current = successors.get(current);
            }
            cleared.addAll(path);
        }
    }
}
