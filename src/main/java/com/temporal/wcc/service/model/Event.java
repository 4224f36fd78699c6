package com.temporal.wcc.service.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * An immutable interaction event, the event side of the bipartite graph.
 *
 * Events are ordered by {@code (timestamp, id)} wherever order matters:
 * entity chains, merge order inside a group, and head ordering.
 */
public record Event(
        String id,
        Instant timestamp,
        String interactionType,
        BigDecimal amount
) {

    public static final Comparator<Event> CHRONOLOGICAL =
            Comparator.comparing(Event::timestamp).thenComparing(Event::id);

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Event of(String id, Instant timestamp) {
        return new Event(id, timestamp, null, null);
    }

    /**
     * True if this event sorts strictly before the other in chronological order.
     */
    public boolean isBefore(Event other) {
        return CHRONOLOGICAL.compare(this, other) < 0;
    }
}
