package com.dicalc.domain.exception;

public enum ErrorKind {
    VALIDATION,
    INVALID_PAYMENT_DATE,
    RATE_NOT_FOUND,
    MISSING_CYCLE,
    INVALID_PARAMETER
}
