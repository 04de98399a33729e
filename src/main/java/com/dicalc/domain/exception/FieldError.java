package com.dicalc.domain.exception;

/**
 * A single rejected request field
 */
public record FieldError(ErrorKind kind, String field, String message) {

    public static FieldError validation(String field, String message) {
        return new FieldError(ErrorKind.VALIDATION, field, message);
    }

    public static FieldError invalidParameter(String field, String message) {
        return new FieldError(ErrorKind.INVALID_PARAMETER, field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
