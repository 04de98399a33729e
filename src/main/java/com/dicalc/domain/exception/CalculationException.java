package com.dicalc.domain.exception;

import java.util.List;

/**
 * Base of every error raised before a calculation result exists.
 * Carries the error kind and the offending field so callers can surface them verbatim.
 */
public class CalculationException extends RuntimeException {

    private final ErrorKind kind;
    private final String field;
    private final List<FieldError> errors;

    public CalculationException(ErrorKind kind, String field, String message) {
        this(kind, List.of(new FieldError(kind, field, message)));
    }

    public CalculationException(ErrorKind kind, List<FieldError> errors) {
        super(errors.isEmpty() ? kind.name() : errors.get(0).message());
        this.kind = kind;
        this.field = errors.isEmpty() ? null : errors.get(0).field();
        this.errors = List.copyOf(errors);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    /**
     * Builds the exception type matching the first error's kind
     */
    public static CalculationException of(List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one error is required");
        }
        return switch (errors.get(0).kind()) {
            case MISSING_CYCLE -> new MissingCycleException(errors);
            case INVALID_PARAMETER -> new InvalidParameterException(errors);
            case INVALID_PAYMENT_DATE -> new InvalidPaymentDateException(errors);
            case RATE_NOT_FOUND -> new CalculationException(ErrorKind.RATE_NOT_FOUND, errors);
            case VALIDATION -> new ValidationException(errors);
        };
    }
}
