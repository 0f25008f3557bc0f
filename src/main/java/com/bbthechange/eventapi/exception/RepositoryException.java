package com.bbthechange.eventapi.exception;

/**
 * Thrown when the events table cannot be read or written.
 * Carries the store operation that failed; the SDK error stays as the cause and is never shown to clients.
 */
public class RepositoryException extends RuntimeException {

    private final String operation;

    public RepositoryException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
