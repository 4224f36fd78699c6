package com.temporal.wcc.service.engine;

import com.temporal.wcc.service.model.Event;

import java.util.List;

/**
 * Unprocessed events of one planned component, in chronological order.
 */
public record MergeGroup(String label, List<Event> events) {

    public MergeGroup {
        events = events.stream().sorted(Event.CHRONOLOGICAL).toList();
    }

    public List<String> eventIds() {
        return events.stream().map(Event::id).toList();
    }
}
