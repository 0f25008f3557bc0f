package com.bbthechange.eventapi.repository;

import com.bbthechange.eventapi.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for event records in the events table.
 * Failures of the underlying store surface as {@link com.bbthechange.eventapi.exception.RepositoryException}.
 */
public interface EventRepository {

    /**
     * Write the event, replacing any item stored under the same eventId.
     * @param event The event to store
     * @return The stored event
     */
    Event save(Event event);

    /**
     * Point lookup by eventId.
     * @param eventId The event identifier
     * @return Optional containing the event, empty when nothing is stored under the id
     */
    Optional<Event> findById(String eventId);

    /**
     * Read every event, optionally keeping only those whose status equals the given value.
     * The status predicate is evaluated by DynamoDB and all result pages are read.
     * @param status Status to match, or empty for all events
     * @return All matching events in scan order
     */
    List<Event> findAll(Optional<String> status);

    /**
     * Remove the event stored under eventId.
     * @param eventId The event identifier
     * @return true if an item existed and was removed
     */
    boolean deleteById(String eventId);
}
