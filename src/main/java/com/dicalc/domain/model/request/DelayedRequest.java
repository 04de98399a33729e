package com.dicalc.domain.model.request;

import com.dicalc.domain.model.CalculationMode;

import java.math.BigDecimal;

/**
 * Delayed-performance interest on a judgment debt at the statutory daily rate
 */
public record DelayedRequest(CalculationTerms terms) implements CalculationRequest {

    /** 0.0175% per day */
    public static final BigDecimal DAILY_RATE = new BigDecimal("0.000175");

    @Override
    public CalculationMode mode() {
        return CalculationMode.DELAYED;
    }

    @Override
    public String rateBasis() {
        return "statutory daily 0.0175%";
    }
}
