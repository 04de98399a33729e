package com.dicalc.application.engine.mode;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.OutstandingBalance;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.request.CalculationRequest;

import java.math.BigDecimal;

/**
 * Interest algorithm for one calculation mode, applied one period at a time
 */
public interface ModeCalculator {

    CalculationMode mode();

    /**
     * Unrounded interest of the period and the formula that produced it
     */
    PeriodResult accrue(Period period, CalculationRequest request);

    /**
     * Amount interest accrues on while the balance stands as given
     */
    default BigDecimal accrualBase(OutstandingBalance balance) {
        return balance.getPrincipal();
    }

    /**
     * Whether interest accrued so far is added to the principal once this period closes
     */
    default boolean capitalizesAfter(Period period, CalculationRequest request) {
        return false;
    }
}
