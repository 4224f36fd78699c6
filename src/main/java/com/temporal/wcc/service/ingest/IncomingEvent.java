package com.temporal.wcc.service.ingest;

import com.temporal.wcc.service.model.Entity;
import com.temporal.wcc.service.model.Event;

import java.util.Set;

/**
 * An event together with the entities it touches, as received from a producer.
 */
public record IncomingEvent(Event event, Set<Entity> entities) {

    public IncomingEvent {
        entities = Set.copyOf(entities);
    }
}
