package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.FloatingRequest;

/**
 * Benchmark rate in force at the period start, times the multiplier
 */
public class FloatingInterestCalculator extends AnnualRateCalculator {

    public FloatingInterestCalculator(DayCountEngine dayCount) {
        super(dayCount);
    }

    @Override
    public CalculationMode mode() {
        return CalculationMode.FLOATING;
    }

    @Override
    public PeriodResult accrue(Period period, CalculationRequest request) {
        FloatingRequest floating = (FloatingRequest) request;
        return accrueAtAnnualRate(period, request, floating.multiplier());
    }
}
