package com.dicalc.application.service;

import com.dicalc.domain.exception.CalculationException;
import com.dicalc.domain.exception.FieldError;

import java.util.Collections;
import java.util.List;

/**
 * Result of validation operation
 */
public record ValidationResult(boolean isValid, List<FieldError> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(FieldError error) {
        return new ValidationResult(false, Collections.singletonList(error));
    }

    public static ValidationResult invalid(List<FieldError> errors) {
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }

    /**
     * Exception typed after the first error, carrying all of them
     */
    public CalculationException toException() {
        if (isValid) {
            throw new IllegalStateException("A valid result has no exception");
        }
        return CalculationException.of(errors);
    }
}
