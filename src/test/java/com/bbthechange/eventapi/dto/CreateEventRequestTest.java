package com.bbthechange.eventapi.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static com.bbthechange.eventapi.testutil.EventTestBuilder.anEvent;
import static org.assertj.core.api.Assertions.assertThat;

class CreateEventRequestTest {

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validRequest_HasNoViolations() {
        assertThat(validator.validate(anEvent().buildCreateRequest())).isEmpty();
    }

    @Test
    void emptyDescription_IsAllowed() {
        CreateEventRequest request = anEvent().withDescription("").buildCreateRequest();

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void zeroCapacity_IsAllowed() {
        CreateEventRequest request = anEvent().withCapacity(0).buildCreateRequest();

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void missingFields_AreAllReported() {
        CreateEventRequest request = new CreateEventRequest();

        Set<String> fields = violatedFields(validator.validate(request));

        assertThat(fields).containsExactlyInAnyOrder(
            "title", "description", "date", "location", "capacity", "organizer", "status");
    }

    @Test
    void blankTitle_IsRejected() {
        CreateEventRequest request = anEvent().withTitle("   ").buildCreateRequest();

        assertThat(violatedFields(validator.validate(request))).containsExactly("title");
    }

    @Test
    void negativeCapacity_IsRejected() {
        CreateEventRequest request = anEvent().withCapacity(-1).buildCreateRequest();

        assertThat(violatedFields(validator.validate(request))).containsExactly("capacity");
    }

    @Test
    void dateWithTime_IsRejected() {
        CreateEventRequest request = anEvent().withDate("2024-12-15T10:00:00").buildCreateRequest();

        assertThat(violatedFields(validator.validate(request))).containsExactly("date");
    }

    private Set<String> violatedFields(Set<ConstraintViolation<CreateEventRequest>> violations) {
        return violations.stream()
            .map(v -> v.getPropertyPath().toString())
            .collect(Collectors.toSet());
    }
}
