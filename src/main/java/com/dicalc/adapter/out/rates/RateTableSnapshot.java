package com.dicalc.adapter.out.rates;

import java.math.BigDecimal;
import java.util.List;

/**
 * YAML form of the embedded rate table. Each entry is one publication date carrying both terms.
 */
public record RateTableSnapshot(String version, String asOf, List<Publication> entries) {

    public record Publication(String date, BigDecimal shortTerm, BigDecimal longTerm) {
    }
}
