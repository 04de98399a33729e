package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;

import java.math.BigDecimal;

public class SimpleInterestCalculator extends AnnualRateCalculator {

    public SimpleInterestCalculator(DayCountEngine dayCount) {
        super(dayCount);
    }

    @Override
    public CalculationMode mode() {
        return CalculationMode.SIMPLE;
    }

    @Override
    public PeriodResult accrue(Period period, CalculationRequest request) {
        return accrueAtAnnualRate(period, request, BigDecimal.ONE);
    }
}
