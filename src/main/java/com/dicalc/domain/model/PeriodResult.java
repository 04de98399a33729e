package com.dicalc.domain.model;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;

/**
 * A period together with the interest it produced, unrounded
 */
@Value
public class PeriodResult {
    Period period;
    BigDecimal subInterest;
    String formula;
    @With
    String note;

    public static PeriodResult of(Period period, BigDecimal subInterest, String formula) {
        return new PeriodResult(period, subInterest, formula, null);
    }

    public PeriodResult appendNote(String text) {
        return withNote(note == null ? text : note + "; " + text);
    }
}
