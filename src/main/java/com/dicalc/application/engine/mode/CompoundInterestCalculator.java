package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.CompoundRequest;

import java.math.BigDecimal;

/**
 * Simple-style accrual with interest capitalised at each cycle end and at the end of the range
 */
public class CompoundInterestCalculator extends AnnualRateCalculator {

    public CompoundInterestCalculator(DayCountEngine dayCount) {
        super(dayCount);
    }

    @Override
    public CalculationMode mode() {
        return CalculationMode.COMPOUND;
    }

    @Override
    public PeriodResult accrue(Period period, CalculationRequest request) {
        return accrueAtAnnualRate(period, request, BigDecimal.ONE);
    }

    @Override
    public boolean capitalizesAfter(Period period, CalculationRequest request) {
        CompoundRequest compound = (CompoundRequest) request;
        return compound.cycle().isCycleEnd(period.getEndDate())
                || period.getEndDate().equals(compound.terms().endDate());
    }
}
