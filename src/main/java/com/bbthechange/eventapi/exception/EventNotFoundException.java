package com.bbthechange.eventapi.exception;

/**
 * Exception thrown when no event is stored under the requested identifier.
 */
public class EventNotFoundException extends RuntimeException {

    private final String eventId;

    public EventNotFoundException(String eventId) {
        super("Event with id '" + eventId + "' not found");
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
