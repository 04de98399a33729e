package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.application.engine.Decimals;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Shared formula of the annual-rate modes: principal base × annual rate ÷ 100 ÷ base days × days
 */
@RequiredArgsConstructor
abstract class AnnualRateCalculator implements ModeCalculator {

    protected final DayCountEngine dayCount;

    protected PeriodResult accrueAtAnnualRate(Period period, CalculationRequest request, BigDecimal multiplier) {
        int baseDays = request.dayCount()
                .orElseThrow(() -> new IllegalStateException(mode() + " request without day-count basis"))
                .getBaseDays();
        BigDecimal interest = dayCount.accrue(period.getPrincipalBase(), period.getApplicableRate(), baseDays, period.getDays());
        return PeriodResult.of(period, interest, formula(period, baseDays, multiplier));
    }

    private String formula(Period period, int baseDays, BigDecimal multiplier) {
        String rate = period.getBenchmarkRate() == null
                ? Decimals.plain(period.getApplicableRate()) + "%"
                : "(" + Decimals.plain(period.getBenchmarkRate()) + "% × " + Decimals.plain(multiplier) + ")";
        return String.format("%s × %s ÷ %d × %d",
                Decimals.plain(period.getPrincipalBase()), rate, baseDays, period.getDays());
    }
}
