package com.dicalc.application.service;

import com.dicalc.application.port.in.RateLookupUseCase;
import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.domain.exception.ValidationException;
import com.dicalc.domain.model.RateTerm;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Answers which benchmark rate was in force on a date. Without a date the snapshot's as-of date is used.
 */
@RequiredArgsConstructor
public class RateLookupService implements RateLookupUseCase {

    private final RateTableProvider rateTable;

    @Override
    public RateQuote lookup(String term, String date) {
        if (term == null || !RateTerm.isValid(term)) {
            throw new ValidationException("term", "term must be either 1y or 5y");
        }
        RateTerm rateTerm = RateTerm.fromValue(term);
        LocalDate on = parse(date);

        BigDecimal rate = rateTable.lookup(rateTerm, on);
        return new RateQuote(rateTerm.getValue(), on, rate, rateTable.version(), rateTable.asOf());
    }

    private LocalDate parse(String date) {
        if (date == null || date.isBlank()) {
            return rateTable.asOf();
        }
        try {
            return RequestValidator.parseDate(date);
        } catch (DateTimeParseException e) {
            throw new ValidationException("date", "date must be in ISO format (YYYY-MM-DD)");
        }
    }
}
