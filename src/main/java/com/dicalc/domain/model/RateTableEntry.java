package com.dicalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One published benchmark rate. In force from its effective date until the next entry of the same term.
 */
@Value
public class RateTableEntry {
    RateTerm term;
    LocalDate effectiveDate;
    BigDecimal annualRatePercent;
}
