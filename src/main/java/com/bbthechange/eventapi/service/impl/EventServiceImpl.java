package com.bbthechange.eventapi.service.impl;

import com.bbthechange.eventapi.dto.CreateEventRequest;
import com.bbthechange.eventapi.dto.UpdateEventRequest;
import com.bbthechange.eventapi.exception.EventNotFoundException;
import com.bbthechange.eventapi.exception.RepositoryException;
import com.bbthechange.eventapi.exception.ValidationException;
import com.bbthechange.eventapi.model.Event;
import com.bbthechange.eventapi.repository.EventRepository;
import com.bbthechange.eventapi.service.EventResult;
import com.bbthechange.eventapi.service.EventService;
import com.bbthechange.eventapi.service.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Implementation of EventService on top of EventRepository.
 *
 * Internally the rules throw {@link EventNotFoundException} and {@link ValidationException};
 * {@link #execute} folds those, and store failures, into an {@link EventResult}.
 */
@Service
public class EventServiceImpl implements EventService {

    private static final Logger logger = LoggerFactory.getLogger(EventServiceImpl.class);

    private final EventRepository eventRepository;
    private final EventValidator eventValidator;

    @Autowired
    public EventServiceImpl(EventRepository eventRepository, EventValidator eventValidator) {
        this.eventRepository = eventRepository;
        this.eventValidator = eventValidator;
    }

    @Override
    public EventResult<Event> createEvent(CreateEventRequest request) {
        return execute("create", () -> {
            String eventId = hasText(request.getEventId())
                ? request.getEventId()
                : UUID.randomUUID().toString();

            Event event = Event.builder()
                .eventId(eventId)
                .title(request.getTitle())
                .description(request.getDescription())
                .date(request.getDate())
                .location(request.getLocation())
                .capacity(request.getCapacity())
                .organizer(request.getOrganizer())
                .status(request.getStatus())
                .build();

            eventValidator.validate(event);

            // No existence check: a reused eventId replaces the stored record
            Event saved = eventRepository.save(event);
            logger.info("Created event {}", saved.getEventId());
            return saved;
        });
    }

    @Override
    public EventResult<Event> getEvent(String eventId) {
        return execute("get", () -> requireEvent(eventId));
    }

    @Override
    public EventResult<List<Event>> listEvents(String status) {
        return execute("list", () -> {
            Optional<String> filter = hasText(status) ? Optional.of(status) : Optional.empty();
            List<Event> events = eventRepository.findAll(filter);
            logger.debug("Listed {} events (status filter: {})", events.size(), filter.orElse("none"));
            return events;
        });
    }

    @Override
    public EventResult<Event> updateEvent(String eventId, UpdateEventRequest request) {
        return execute("update", () -> {
            // Always merge against a fresh read so untouched fields keep their stored values
            Event existing = requireEvent(eventId);
            Event merged = merge(existing, request);

            eventValidator.validate(merged);

            Event saved = eventRepository.save(merged);
            logger.info("Updated event {} (fields: {})", eventId, request.getPresentFields());
            return saved;
        });
    }

    @Override
    public EventResult<Void> deleteEvent(String eventId) {
        return execute("delete", () -> {
            requireEvent(eventId);

            boolean existed = eventRepository.deleteById(eventId);
            if (!existed) {
                // removed by a concurrent request between the read and the delete
                logger.debug("Event {} was already gone at delete time", eventId);
            }
            logger.info("Deleted event {}", eventId);
            return null;
        });
    }

    private Event requireEvent(String eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    Event merge(Event existing, UpdateEventRequest request) {
        Event.EventBuilder merged = existing.toBuilder();

        if (request.isPresent(UpdateEventRequest.TITLE)) {
            merged.title(request.getTitle());
        }
        if (request.isPresent(UpdateEventRequest.DESCRIPTION)) {
            merged.description(request.getDescription());
        }
        if (request.isPresent(UpdateEventRequest.DATE)) {
            merged.date(request.getDate());
        }
        if (request.isPresent(UpdateEventRequest.LOCATION)) {
            merged.location(request.getLocation());
        }
        if (request.isPresent(UpdateEventRequest.CAPACITY)) {
            merged.capacity(request.getCapacity());
        }
        if (request.isPresent(UpdateEventRequest.ORGANIZER)) {
            merged.organizer(request.getOrganizer());
        }
        if (request.isPresent(UpdateEventRequest.STATUS)) {
            merged.status(request.getStatus());
        }

        // eventId is never taken from the payload
        return merged.eventId(existing.getEventId()).build();
    }

    private <T> EventResult<T> execute(String operation, Supplier<T> action) {
        try {
            return EventResult.ok(action.get());
        } catch (EventNotFoundException e) {
            logger.debug("{}: event {} not found", operation, e.getEventId());
            return EventResult.notFound(e.getEventId());
        } catch (ValidationException e) {
            logger.warn("{}: validation failed: {}", operation, e.getDetails());
            return EventResult.validationError(e.getDetails());
        } catch (RepositoryException e) {
            logger.error("{}: storage failure during {}: {}", operation, e.getOperation(), e.getMessage());
            return EventResult.storageError(e.getMessage());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
