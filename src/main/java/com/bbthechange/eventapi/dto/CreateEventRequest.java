package com.bbthechange.eventapi.dto;

import com.bbthechange.eventapi.model.Event;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating an event. {@code eventId} is optional; one is generated when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEventRequest {

    private String eventId;

    @NotBlank(message = "Title is required")
    private String title;

    @NotNull(message = "Description is required")
    private String description;

    @NotNull(message = "Date is required")
    @Pattern(regexp = Event.DATE_PATTERN, message = "Date must be in YYYY-MM-DD format")
    private String date;

    @NotBlank(message = "Location is required")
    private String location;

    @NotNull(message = "Capacity is required")
    @Min(value = 0, message = "Capacity must be non-negative")
    private Integer capacity;

    @NotBlank(message = "Organizer is required")
    private String organizer;

    @NotBlank(message = "Status is required")
    private String status;
}
