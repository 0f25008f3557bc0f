package com.bbthechange.eventapi.dto;

import com.bbthechange.eventapi.model.Event;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partial update payload. Every field is optional.
 *
 * Jackson only calls a setter for keys that appear in the request body, so each setter
 * records its field as present. A key sent with an explicit null or empty value is present;
 * a key left out of the body is not, and the stored value is kept for it.
 */
@Getter
@ToString
public class UpdateEventRequest {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String DATE = "date";
    public static final String LOCATION = "location";
    public static final String CAPACITY = "capacity";
    public static final String ORGANIZER = "organizer";
    public static final String STATUS = "status";

    private String title;

    private String description;

    @Pattern(regexp = Event.DATE_PATTERN, message = "Date must be in YYYY-MM-DD format")
    private String date;

    private String location;

    @Min(value = 0, message = "Capacity must be non-negative")
    private Integer capacity;

    private String organizer;

    private String status;

    @JsonIgnore
    @ToString.Exclude
    private final Set<String> presentFields = new LinkedHashSet<>();

    public void setTitle(String title) {
        this.title = title;
        presentFields.add(TITLE);
    }

    public void setDescription(String description) {
        this.description = description;
        presentFields.add(DESCRIPTION);
    }

    public void setDate(String date) {
        this.date = date;
        presentFields.add(DATE);
    }

    public void setLocation(String location) {
        this.location = location;
        presentFields.add(LOCATION);
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
        presentFields.add(CAPACITY);
    }

    public void setOrganizer(String organizer) {
        this.organizer = organizer;
        presentFields.add(ORGANIZER);
    }

    public void setStatus(String status) {
        this.status = status;
        presentFields.add(STATUS);
    }

    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }

    @JsonIgnore
    public Set<String> getPresentFields() {
        return Collections.unmodifiableSet(presentFields);
    }
}
