package com.dicalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw and capped totals side by side. The caller decides which one to use.
 */
@Value
public class CapResult {
    BigDecimal capMultiplier;
    RateTerm capTerm;
    BigDecimal rawTotal;
    BigDecimal capLimitTotal;
    BigDecimal cappedTotal;
    List<BigDecimal> periodLimits;  // unrounded, aligned with the result's periods

    public boolean isCapApplied() {
        return rawTotal.compareTo(capLimitTotal) > 0;
    }
}
