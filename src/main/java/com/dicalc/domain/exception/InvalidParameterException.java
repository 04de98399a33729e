package com.dicalc.domain.exception;

import java.util.List;

/**
 * A mode-specific field was omitted or contradicts the selected mode
 */
public class InvalidParameterException extends CalculationException {

    public InvalidParameterException(String field, String message) {
        super(ErrorKind.INVALID_PARAMETER, field, message);
    }

    public InvalidParameterException(List<FieldError> errors) {
        super(ErrorKind.INVALID_PARAMETER, errors);
    }
}
