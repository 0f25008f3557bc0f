package com.bbthechange.eventapi.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateEventRequestTest {

    private ObjectMapper objectMapper;
    private Validator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void deserialize_OnlyKeysInBodyArePresent() throws Exception {
        UpdateEventRequest request = objectMapper.readValue(
            "{\"title\":\"New title\",\"capacity\":0}", UpdateEventRequest.class);

        assertThat(request.getPresentFields())
            .containsExactlyInAnyOrder(UpdateEventRequest.TITLE, UpdateEventRequest.CAPACITY);
        assertThat(request.isPresent(UpdateEventRequest.DESCRIPTION)).isFalse();
        assertThat(request.getTitle()).isEqualTo("New title");
        assertThat(request.getCapacity()).isZero();
    }

    @Test
    void deserialize_ExplicitNullCountsAsPresent() throws Exception {
        UpdateEventRequest request = objectMapper.readValue("{\"status\":null}", UpdateEventRequest.class);

        assertThat(request.isPresent(UpdateEventRequest.STATUS)).isTrue();
        assertThat(request.getStatus()).isNull();
    }

    @Test
    void deserialize_EmptyStringCountsAsPresent() throws Exception {
        UpdateEventRequest request = objectMapper.readValue("{\"description\":\"\"}", UpdateEventRequest.class);

        assertThat(request.isPresent(UpdateEventRequest.DESCRIPTION)).isTrue();
        assertThat(request.getDescription()).isEmpty();
    }

    @Test
    void deserialize_EmptyObject_HasNoPresentFields() throws Exception {
        UpdateEventRequest request = objectMapper.readValue("{}", UpdateEventRequest.class);

        assertThat(request.getPresentFields()).isEmpty();
    }

    @Test
    void serialize_DoesNotExposePresenceTracking() throws Exception {
        UpdateEventRequest request = new UpdateEventRequest();
        request.setLocation("Berlin");

        String json = objectMapper.writeValueAsString(request);

        assertThat(json).contains("\"location\":\"Berlin\"");
        assertThat(json).doesNotContain("presentFields");
    }

    @Test
    void validation_NegativeCapacity_Fails() {
        UpdateEventRequest request = new UpdateEventRequest();
        request.setCapacity(-1);

        Set<ConstraintViolation<UpdateEventRequest>> violations = validator.validate(request);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getPropertyPath().toString()).isEqualTo("capacity");
    }

    @Test
    void validation_BadDateFormat_Fails() {
        UpdateEventRequest request = new UpdateEventRequest();
        request.setDate("2024/12/15");

        assertThat(validator.validate(request)).hasSize(1);
    }

    @Test
    void validation_AbsentFields_AreNotChecked() {
        assertThat(validator.validate(new UpdateEventRequest())).isEmpty();
    }
}
