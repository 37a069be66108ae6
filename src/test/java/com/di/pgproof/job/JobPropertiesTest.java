package com.di.pgproof.job;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobProperties Tests")
class JobPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static Set<String> invalidFields(JobProperties properties) {
        return validator.validate(properties).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Defaults are valid")
    void testDefaults() {
        assertTrue(invalidFields(new JobProperties()).isEmpty());
    }

    @Test
    @DisplayName("Pool and queue sizes must be positive")
    void testSizes() {
        JobProperties properties = new JobProperties();
        properties.setMaxConcurrency(0);
        properties.setQueueCapacity(0);
        properties.setMaxListLimit(0);

        assertEquals(Set.of("maxConcurrency", "queueCapacity", "maxListLimit"), invalidFields(properties));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -5.0, 100.5})
    @DisplayName("Sample percent must be in (0, 100]")
    void testSamplePercent_Invalid(double percent) {
        JobProperties properties = new JobProperties();
        properties.setSamplePercent(percent);

        assertEquals(Set.of("samplePercent"), invalidFields(properties));
    }
}
