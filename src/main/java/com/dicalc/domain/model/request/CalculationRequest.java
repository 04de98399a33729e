package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.RateTerm;

import java.util.List;
import java.util.Optional;

/**
 * A validated calculation request. Each mode has its own variant carrying only the fields it accepts.
 */
public interface CalculationRequest {

    CalculationMode mode();

    CalculationTerms terms();

    /**
     * Human-readable rate description for reports
     */
    String rateBasis();

    /**
     * Base days used to turn an annual rate into a daily one; empty for fixed daily-rate modes
     */
    default Optional<DayCountBasis> dayCount() {
        return Optional.empty();
    }

    /**
     * Rate-table terms whose rate changes split the calculation range
     */
    default List<RateTerm> pricingTerms() {
        return List.of();
    }
}
