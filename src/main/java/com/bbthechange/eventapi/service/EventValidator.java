package com.bbthechange.eventapi.service;

import com.bbthechange.eventapi.exception.ValidationException;
import com.bbthechange.eventapi.model.Event;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Checks a complete event record against the constraints declared on {@link Event}.
 * Also rejects dates that match YYYY-MM-DD but are not real calendar days.
 */
@Component
public class EventValidator {

    private final Validator validator;

    @Autowired
    public EventValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws ValidationException listing every violated rule as {@code field: message}
     */
    public void validate(Event event) {
        Set<ConstraintViolation<Event>> violations = validator.validate(event);

        List<String> details = new ArrayList<>();
        for (ConstraintViolation<Event> violation : violations) {
            details.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }

        boolean dateFlagged = violations.stream()
                .anyMatch(v -> "date".equals(v.getPropertyPath().toString()));
        if (!dateFlagged && !isCalendarDate(event.getDate())) {
            details.add("date: " + event.getDate() + " is not a valid calendar date");
        }

        if (!details.isEmpty()) {
            Collections.sort(details);
            throw new ValidationException(details);
        }
    }

    // ISO_LOCAL_DATE resolves strictly, so 2024-02-30 fails here
    private boolean isCalendarDate(String date) {
        try {
            LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
