package com.dicalc.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one calculation request.
 * totalInterest is rawTotal rounded once, HALF_UP to two decimals.
 */
@Value
@Builder(toBuilder = true)
public class CalculationResult {
    CalculationMode mode;
    BigDecimal principal;
    LocalDate startDate;
    LocalDate endDate;
    String rateBasis;
    DayCountBasis dayCount;  // null for delayed-performance interest
    @Singular
    List<PeriodResult> periods;
    BigDecimal rawTotal;
    BigDecimal totalInterest;
    CapResult cap;
    @Singular
    List<PaymentAllocation> allocations;
    OutstandingBalance closingBalance;
    @Singular
    List<CalculationWarning> warnings;
    String rateTableVersion;
    LocalDate rateTableAsOf;

    public int getTotalDays() {
        return periods.stream().mapToInt(p -> p.getPeriod().getDays()).sum();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
