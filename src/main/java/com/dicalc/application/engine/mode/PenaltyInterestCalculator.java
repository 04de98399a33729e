package com.dicalc.application.engine.mode;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.PenaltyRequest;

import java.math.BigDecimal;

/**
 * Penalty interest on a fixed or floating basis. The dispatcher runs the cap check afterwards.
 */
public class PenaltyInterestCalculator extends AnnualRateCalculator {

    public PenaltyInterestCalculator(DayCountEngine dayCount) {
        super(dayCount);
    }

    @Override
    public CalculationMode mode() {
        return CalculationMode.PENALTY;
    }

    @Override
    public PeriodResult accrue(Period period, CalculationRequest request) {
        PenaltyRequest penalty = (PenaltyRequest) request;
        return accrueAtAnnualRate(period, request, penalty.isFloating() ? penalty.multiplier() : BigDecimal.ONE);
    }
}
