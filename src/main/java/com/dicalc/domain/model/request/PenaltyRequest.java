package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.PenaltyBasis;
import com.dicalc.domain.model.RateTerm;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Penalty interest. FIXED basis uses annualRatePercent; FLOATING uses term and multiplier.
 * The cap is always checked against capMultiplier times the capTerm benchmark.
 */
public record PenaltyRequest(
        CalculationTerms terms,
        PenaltyBasis basis,
        BigDecimal annualRatePercent,
        RateTerm term,
        BigDecimal multiplier,
        DayCountBasis dayCountBasis,
        BigDecimal capMultiplier,
        RateTerm capTerm
) implements CalculationRequest {

    @Override
    public CalculationMode mode() {
        return CalculationMode.PENALTY;
    }

    @Override
    public String rateBasis() {
        String raw = basis == PenaltyBasis.FIXED
                ? "fixed " + annualRatePercent.toPlainString() + "% p.a."
                : term.getValue() + " LPR x " + multiplier.toPlainString();
        return "penalty " + raw + ", capped at " + capTerm.getValue() + " LPR x " + capMultiplier.toPlainString();
    }

    @Override
    public Optional<DayCountBasis> dayCount() {
        return Optional.of(dayCountBasis);
    }

    @Override
    public List<RateTerm> pricingTerms() {
        if (basis == PenaltyBasis.FLOATING && term != capTerm) {
            return List.of(term, capTerm);
        }
        return List.of(capTerm);
    }

    public boolean isFloating() {
        return basis == PenaltyBasis.FLOATING;
    }
}
