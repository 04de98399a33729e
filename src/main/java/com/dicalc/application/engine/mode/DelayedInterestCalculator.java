package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.application.engine.Decimals;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.OutstandingBalance;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Delayed-performance interest: full judgment debt × 0.0175% × days. No base days, no rate table.
 */
@RequiredArgsConstructor
public class DelayedInterestCalculator implements ModeCalculator {

    private final DayCountEngine dayCount;

    @Override
    public CalculationMode mode() {
        return CalculationMode.DELAYED;
    }

    /**
     * Unpaid principal, judgment interest and costs. Delayed-performance interest does not accrue on itself.
     */
    @Override
    public BigDecimal accrualBase(OutstandingBalance balance) {
        return balance.judgmentAmount();
    }

    @Override
    public PeriodResult accrue(Period period, CalculationRequest request) {
        BigDecimal interest = dayCount.accrueDaily(period.getPrincipalBase(), period.getDailyRate(), period.getDays());
        String formula = String.format("%s × 0.0175%% × %d",
                Decimals.plain(period.getPrincipalBase()), period.getDays());
        return PeriodResult.of(period, interest, formula);
    }
}
