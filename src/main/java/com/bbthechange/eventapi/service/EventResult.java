package com.bbthechange.eventapi.service;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Outcome of an {@link EventService} operation.
 * Callers switch on {@link #getStatus()} instead of catching exceptions.
 */
public class EventResult<T> {

    public enum Status {
        OK,
        NOT_FOUND,
        VALIDATION_ERROR,
        STORAGE_ERROR
    }

    private final Status status;
    private final T value;
    private final String eventId;
    private final List<String> details;
    private final String message;

    private EventResult(Status status, T value, String eventId, List<String> details, String message) {
        this.status = status;
        this.value = value;
        this.eventId = eventId;
        this.details = details;
        this.message = message;
    }

    public static <T> EventResult<T> ok(T value) {
        return new EventResult<>(Status.OK, value, null, List.of(), null);
    }

    public static <T> EventResult<T> notFound(String eventId) {
        return new EventResult<>(Status.NOT_FOUND, null, eventId, List.of(),
                "Event with id '" + eventId + "' not found");
    }

    public static <T> EventResult<T> validationError(List<String> details) {
        return new EventResult<>(Status.VALIDATION_ERROR, null, null, List.copyOf(details),
                String.join("; ", details));
    }

    public static <T> EventResult<T> storageError(String message) {
        return new EventResult<>(Status.STORAGE_ERROR, null, null, List.of(), message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * @throws NoSuchElementException if the operation did not succeed
     */
    public T getValue() {
        if (status != Status.OK) {
            throw new NoSuchElementException("No value for " + status + " result: " + message);
        }
        return value;
    }

    /** Identifier that was not found; null for other outcomes. */
    public String getEventId() {
        return eventId;
    }

    public List<String> getDetails() {
        return details;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "EventResult{status=" + status + (message != null ? ", message=" + message : "") + "}";
    }
}
