package com.bbthechange.eventapi.exception;

import java.util.List;

/**
 * Exception thrown when an event violates a field rule (required, format or range).
 * Each entry in {@link #getDetails()} reads {@code field: message}.
 */
public class ValidationException extends RuntimeException {

    private final List<String> details;

    public ValidationException(List<String> details) {
        super("Validation failed: " + String.join("; ", details));
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}
