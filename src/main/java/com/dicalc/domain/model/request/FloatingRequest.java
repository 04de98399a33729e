package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.RateTerm;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Benchmark-linked interest. capMultiplier is optional; when present a capped total is reported too.
 */
public record FloatingRequest(
        CalculationTerms terms,
        RateTerm term,
        BigDecimal multiplier,
        DayCountBasis basis,
        BigDecimal capMultiplier,
        RateTerm capTerm
) implements CalculationRequest {

    @Override
    public CalculationMode mode() {
        return CalculationMode.FLOATING;
    }

    @Override
    public String rateBasis() {
        return term.getValue() + " LPR x " + multiplier.toPlainString();
    }

    @Override
    public Optional<DayCountBasis> dayCount() {
        return Optional.of(basis);
    }

    @Override
    public List<RateTerm> pricingTerms() {
        if (capMultiplier == null || capTerm == term) {
            return List.of(term);
        }
        return List.of(term, capTerm);
    }

    public boolean isCapped() {
        return capMultiplier != null;
    }
}
