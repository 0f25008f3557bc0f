package com.bbthechange.eventapi.service;

import com.bbthechange.eventapi.dto.CreateEventRequest;
import com.bbthechange.eventapi.dto.UpdateEventRequest;
import com.bbthechange.eventapi.model.Event;

import java.util.List;

/**
 * Business rules for event records: identifier assignment, existence checks,
 * partial-update merging and status filtering.
 *
 * Every operation reads from and writes to the store directly; nothing is cached between calls.
 */
public interface EventService {

    /**
     * Store a new event. A non-empty client eventId is used as is, otherwise a random UUID is assigned.
     * An existing record with the same eventId is overwritten.
     */
    EventResult<Event> createEvent(CreateEventRequest request);

    /**
     * Look up one event; NOT_FOUND when nothing is stored under the id.
     */
    EventResult<Event> getEvent(String eventId);

    /**
     * All events, or only those whose status equals the given value when it is non-empty.
     * An empty list is a normal result.
     */
    EventResult<List<Event>> listEvents(String status);

    /**
     * Overlay the fields present in the request onto the currently stored record and store the result.
     * Fields absent from the request keep their stored values.
     */
    EventResult<Event> updateEvent(String eventId, UpdateEventRequest request);

    /**
     * Remove an existing event. Deleting an id that is not stored yields NOT_FOUND.
     */
    EventResult<Void> deleteEvent(String eventId);
}
