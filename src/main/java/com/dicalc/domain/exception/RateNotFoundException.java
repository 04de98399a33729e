package com.dicalc.domain.exception;

import com.dicalc.domain.model.RateTerm;

import java.time.LocalDate;

/**
 * The requested date precedes the earliest rate-table entry for the term. Rates are never extrapolated backward.
 */
public class RateNotFoundException extends CalculationException {

    private final RateTerm term;
    private final LocalDate date;

    public RateNotFoundException(RateTerm term, LocalDate date, LocalDate earliest) {
        super(ErrorKind.RATE_NOT_FOUND, "term",
                String.format("No %s rate in force on %s; earliest entry is %s", term.getValue(), date, earliest));
        this.term = term;
        this.date = date;
    }

    public RateTerm getTerm() {
        return term;
    }

    public LocalDate getDate() {
        return date;
    }
}
