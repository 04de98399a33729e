package com.dicalc.application.port.in;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input port for querying the embedded rate table
 */
public interface RateLookupUseCase {

    RateQuote lookup(String term, String date);

    record RateQuote(String term, LocalDate date, BigDecimal annualRatePercent, String version, LocalDate asOf) {}
}
