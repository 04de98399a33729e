package com.dicalc.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial payment made by the debtor. It takes effect from the day after its date.
 */
public record Payment(LocalDate date, BigDecimal amount) {
}
