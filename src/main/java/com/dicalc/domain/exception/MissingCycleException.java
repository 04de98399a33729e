package com.dicalc.domain.exception;

import java.util.List;

public class MissingCycleException extends CalculationException {

    public MissingCycleException(List<FieldError> errors) {
        super(ErrorKind.MISSING_CYCLE, errors);
    }
}
