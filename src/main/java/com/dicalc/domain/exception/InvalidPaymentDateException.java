package com.dicalc.domain.exception;

import java.util.List;

public class InvalidPaymentDateException extends ValidationException {

    public InvalidPaymentDateException(String field, String message) {
        this(List.of(new FieldError(ErrorKind.INVALID_PAYMENT_DATE, field, message)));
    }

    public InvalidPaymentDateException(List<FieldError> errors) {
        super(ErrorKind.INVALID_PAYMENT_DATE, errors);
    }
}
