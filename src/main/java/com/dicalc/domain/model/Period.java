package com.dicalc.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A contiguous run of days priced at one rate on one principal base.
 * Both ends are inclusive.
 */
@Value
@Builder
public class Period {
    LocalDate startDate;
    LocalDate endDate;
    int days;
    @With
    BigDecimal principalBase;
    BigDecimal benchmarkRate;   // annual %, only for rate-table pricing
    BigDecimal applicableRate;  // annual %, null when the mode prices by a fixed daily rate
    BigDecimal dailyRate;       // fraction per day
}
