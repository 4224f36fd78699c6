package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.config.WccConfig;
import com.temporal.wcc.service.model.Event;
import com.temporal.wcc.service.store.ForestTransaction;
import com.temporal.wcc.service.store.ForestView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Append-only union-find over events.
 *
 * Every merge adds edges {@code head -> event}; nothing is ever rewritten, so the
 * forest keeps the history of how components grew. There is no path compression:
 * a compressed forest would lose the as-of-time snapshots the metrics are built on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemporalUnionFindForest {

    private final WccConfig wccConfig;

    // ==================== Head Resolution ====================

    /**
     * Walks outgoing forest edges from the event until a node without one.
     *
     * @throws StructuralViolationException on a cycle or a walk over the configured limit
     */
    public String findHead(ForestView view, String eventId) {
        return walk(view, eventId, next -> false);
    }

    /**
     * Same walk, but never steps into a node that does not sort strictly before
     * {@code boundary}: the node that would lead there is returned instead. Used to
     * see the forest as it was just before the boundary event, including the
     * boundary itself once it has merged.
     */
    public String findHeadBefore(ForestView view, String eventId, Event boundary) {
        return walk(view, eventId, next -> !loadEvent(view, next).isBefore(boundary));
    }

    private String walk(ForestView view, String startId, Predicate<String> stopBefore) {
        int limit = wccConfig.getForest().getMaxWalkLength();
        var visited = new HashSet<String>();
        visited.add(startId);
        String current = startId;
        while (true) {
            Optional<String> next = view.findForestSuccessor(current);
            if (next.isEmpty() || stopBefore.test(next.get())) {
                return current;
            }
            if (!visited.add(next.get())) {
                throw new StructuralViolationException(
                        "Cycle in forest reached from " + startId + " at " + next.get(), startId);
            }
            if (visited.size() > limit) {
                throw new StructuralViolationException(
                        "Forest walk from " + startId + " exceeded " + limit + " steps", startId);
            }
            current = next.get();
        }
    }

    // ==================== Merge ====================

    /**
     * Merges one event: its processed precedence predecessors are resolved to their
     * heads, and each distinct head gets an edge to the event. The processed flag and
     * the edges are written through the same transaction.
     */
    public MergeOutcome merge(ForestTransaction tx, Event event) {
        if (tx.isProcessed(event.id())) {
            log.debug("Event {} already processed, skipping", event.id());
            return MergeOutcome.skipped(event.id());
        }

        var heads = resolveHeads(tx, event.id());
        for (var head : heads) {
            // a head later than the event would make a backward edge; only a rebuild can place it
            if (!loadEvent(tx, head).isBefore(event)) {
                throw new StructuralViolationException(
                        "Head " + head + " is later than event " + event.id() + ", rebuild required", event.id());
            }
        }

        tx.markProcessed(event.id());
        for (var head : heads) {
            tx.addForestEdge(head, event.id());
        }

        if (heads.isEmpty()) {
            log.debug("Event {} starts a new component", event.id());
        } else {
            log.debug("Event {} absorbed {} head(s): {}", event.id(), heads.size(), heads);
        }
        return new MergeOutcome(event.id(), heads, false);
    }

    /**
     * Distinct current heads of the event's processed precedence predecessors,
     * in {@code (timestamp, id)} order.
     */
    public List<String> resolveHeads(ForestView view, String eventId) {
        var heads = new LinkedHashSet<String>();
        for (var predecessor : view.findPrecedencePredecessors(eventId)) {
            if (view.isProcessed(predecessor)) {
                heads.add(findHead(view, predecessor));
            }
        }
        return heads.stream()
                .map(id -> loadEvent(view, id))
                .sorted(Event.CHRONOLOGICAL)
                .map(Event::id)
                .toList();
    }

    private static Event loadEvent(ForestView view, String id) {
        return view.findEvent(id).orElseThrow(() -> new EventNotFoundException(id));
    }
}
