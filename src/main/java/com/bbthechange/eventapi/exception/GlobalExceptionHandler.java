package com.bbthechange.eventapi.exception;

import com.bbthechange.eventapi.dto.ErrorResponse;
import jakarta.servlet.ServletException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps failures raised before or outside the event service to error responses.
 * Request schema problems become 422; anything unexpected becomes 500 without internal details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        if (detail.isEmpty()) {
            detail = "Invalid request body";
        }
        logger.warn("Request validation error: {}", detail);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse("VALIDATION_ERROR", detail));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(HttpMessageNotReadableException e) {
        String detail = e.getMostSpecificCause().getMessage();
        logger.warn("Unreadable request body: {}", detail);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse("VALIDATION_ERROR", "Malformed request body: " + firstLine(detail)));
    }
    
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ErrorResponse> handleServletException(ServletException e) {
        // unknown paths, unsupported methods and media types carry their own status
        HttpStatusCode status = HttpStatus.INTERNAL_SERVER_ERROR;
        if (e instanceof org.springframework.web.ErrorResponse) {
            status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        }
        if (status.is5xxServerError()) {
            logger.error("Request failed: {}", e.getMessage(), e);
            return ResponseEntity.status(status)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
        }
        logger.warn("Request rejected with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse("REQUEST_ERROR", e.getMessage()));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unable to parse JSON";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
