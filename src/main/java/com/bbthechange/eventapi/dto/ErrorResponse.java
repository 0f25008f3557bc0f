package com.bbthechange.eventapi.dto;

/**
 * Error body returned by every failing request.
 * {@code error} is a stable machine-readable code, {@code detail} describes the failure.
 */
public class ErrorResponse {

    private final String error;
    private final String detail;
    private final long timestamp;

    public ErrorResponse(String error, String detail) {
        this.error = error;
        this.detail = detail;
        this.timestamp = System.currentTimeMillis();
    }

    public String getError() { return error; }
    public String getDetail() { return detail; }
    public long getTimestamp() { return timestamp; }
}
