package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.DayCountBasis;

import java.math.BigDecimal;
import java.util.Optional;

public record SimpleRequest(
        CalculationTerms terms,
        BigDecimal annualRatePercent,
        DayCountBasis basis
) implements CalculationRequest {

    @Override
    public CalculationMode mode() {
        return CalculationMode.SIMPLE;
    }

    @Override
    public String rateBasis() {
        return "fixed " + annualRatePercent.toPlainString() + "% p.a.";
    }

    @Override
    public Optional<DayCountBasis> dayCount() {
        return Optional.of(basis);
    }
}
