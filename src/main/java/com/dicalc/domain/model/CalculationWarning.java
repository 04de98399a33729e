package com.dicalc.domain.model;

/**
 * Non-fatal finding attached to a successful result
 */
public record CalculationWarning(WarningCode code, String message) {
}
