package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.CompoundingCycle;
import com.dicalc.domain.model.DayCountBasis;

import java.math.BigDecimal;
import java.util.Optional;

public record CompoundRequest(
        CalculationTerms terms,
        BigDecimal annualRatePercent,
        DayCountBasis basis,
        CompoundingCycle cycle
) implements CalculationRequest {

    @Override
    public CalculationMode mode() {
        return CalculationMode.COMPOUND;
    }

    @Override
    public String rateBasis() {
        return "fixed " + annualRatePercent.toPlainString() + "% p.a., compounded " + cycle.name();
    }

    @Override
    public Optional<DayCountBasis> dayCount() {
        return Optional.of(basis);
    }
}
