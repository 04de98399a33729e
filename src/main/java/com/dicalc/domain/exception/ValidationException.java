package com.dicalc.domain.exception;

import java.util.List;

/**
 * Malformed or contradictory request. Caller error, never retried.
 */
public class ValidationException extends CalculationException {

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, field, message);
    }

    public ValidationException(List<FieldError> errors) {
        super(ErrorKind.VALIDATION, errors);
    }

    protected ValidationException(ErrorKind kind, List<FieldError> errors) {
        super(kind, errors);
    }
}
