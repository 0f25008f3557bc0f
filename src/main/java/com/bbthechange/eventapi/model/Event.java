package com.bbthechange.eventapi.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A stored event record. One item per event in the events table, keyed by {@code eventId}.
 * The constraints here are the invariants every persisted record must satisfy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Event {

    public static final String DATE_PATTERN = "\\d{4}-\\d{2}-\\d{2}";

    @NotEmpty(message = "must not be empty")
    private String eventId;

    @NotBlank(message = "must not be empty")
    private String title;

    @NotNull(message = "is required")
    private String description;

    @NotNull(message = "is required")
    @Pattern(regexp = DATE_PATTERN, message = "must be in YYYY-MM-DD format")
    private String date;

    @NotBlank(message = "must not be empty")
    private String location;

    @NotNull(message = "is required")
    @Min(value = 0, message = "must be greater than or equal to 0")
    private Integer capacity;

    @NotBlank(message = "must not be empty")
    private String organizer;

    @NotBlank(message = "must not be empty")
    private String status;

    @DynamoDbPartitionKey
    public String getEventId() {
        return eventId;
    }
}
