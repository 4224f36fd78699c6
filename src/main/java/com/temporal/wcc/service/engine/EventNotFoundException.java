package com.temporal.wcc.service.engine;

public class EventNotFoundException extends ForestException {

    public EventNotFoundException(String eventId) {
        super("Event not found: " + eventId, eventId, "EVENT_NOT_FOUND");
    }
}
