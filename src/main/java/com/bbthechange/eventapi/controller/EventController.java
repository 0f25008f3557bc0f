package com.bbthechange.eventapi.controller;

import com.bbthechange.eventapi.dto.CreateEventRequest;
import com.bbthechange.eventapi.dto.ErrorResponse;
import com.bbthechange.eventapi.dto.UpdateEventRequest;
import com.bbthechange.eventapi.model.Event;
import com.bbthechange.eventapi.service.EventResult;
import com.bbthechange.eventapi.service.EventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for event records.
 * Translates {@link EventResult} outcomes into HTTP statuses: NOT_FOUND is 404,
 * VALIDATION_ERROR is 422 and STORAGE_ERROR is 500.
 */
@RestController
@RequestMapping("/events")
@Tag(name = "Events", description = "Create, read, list, update and delete events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventService eventService;

    @Autowired
    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @PostMapping
    @Operation(summary = "Create an event", description = "Uses the supplied eventId when present, otherwise generates one")
    public ResponseEntity<?> createEvent(@Valid @RequestBody CreateEventRequest request) {
        logger.info("Creating event (client id: {})", request.getEventId() != null ? request.getEventId() : "none");

        EventResult<Event> result = eventService.createEvent(request);
        return respond(result, HttpStatus.CREATED);
    }

    @GetMapping
    @Operation(summary = "List events", description = "Returns every event, or only those with the given status")
    public ResponseEntity<?> listEvents(
            @Parameter(description = "Only return events with this status")
            @RequestParam(name = "status", required = false) String status) {
        logger.info("Listing events (status filter: {})", status != null ? status : "none");

        EventResult<List<Event>> result = eventService.listEvents(status);
        return respond(result, HttpStatus.OK);
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get an event")
    public ResponseEntity<?> getEvent(@PathVariable String eventId) {
        logger.info("Getting event {}", eventId);

        return respond(eventService.getEvent(eventId), HttpStatus.OK);
    }

    @PutMapping("/{eventId}")
    @Operation(summary = "Update an event", description = "Only fields present in the body are changed")
    public ResponseEntity<?> updateEvent(@PathVariable String eventId,
                                         @Valid @RequestBody UpdateEventRequest request) {
        logger.info("Updating event {} (fields: {})", eventId, request.getPresentFields());

        return respond(eventService.updateEvent(eventId, request), HttpStatus.OK);
    }

    @DeleteMapping("/{eventId}")
    @Operation(summary = "Delete an event")
    public ResponseEntity<?> deleteEvent(@PathVariable String eventId) {
        logger.info("Deleting event {}", eventId);

        EventResult<Void> result = eventService.deleteEvent(eventId);
        if (result.isOk()) {
            return ResponseEntity.ok(Map.of("message", "Event " + eventId + " deleted successfully"));
        }
        return respond(result, HttpStatus.OK);
    }

    private ResponseEntity<?> respond(EventResult<?> result, HttpStatus successStatus) {
        switch (result.getStatus()) {
            case OK:
                return ResponseEntity.status(successStatus).body(result.getValue());
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("EVENT_NOT_FOUND", result.getMessage()));
            case VALIDATION_ERROR:
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(new ErrorResponse("VALIDATION_ERROR", result.getMessage()));
            case STORAGE_ERROR:
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("STORAGE_ERROR", "The event store is unavailable, please try again later"));
            default:
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
        }
    }
}
