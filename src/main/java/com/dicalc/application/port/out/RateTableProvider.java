package com.dicalc.application.port.out;

import com.dicalc.domain.model.RateTerm;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Output port for the historical benchmark rate table.
 * Loaded once at startup and read-only afterwards, so one instance is shared by concurrent calculations.
 */
public interface RateTableProvider {

    /**
     * Annual rate (percent) in force on the given date. Dates after the last entry get the last rate.
     * @throws com.dicalc.domain.exception.RateNotFoundException when the date precedes the first entry
     */
    BigDecimal lookup(RateTerm term, LocalDate date);

    /**
     * Effective dates in (start, end] at which the in-force rate of the term changes, ascending.
     * A publication that repeats the previous rate is not returned, so callers see fewer dates than
     * the table has entries. Splitting at such a date would not change any total.
     */
    List<LocalDate> rateChangeDates(RateTerm term, LocalDate start, LocalDate end);

    /**
     * Effective date of the last entry of the term. Together with {@link #asOf()} it bounds the dates
     * whose rate is known rather than carried forward.
     */
    LocalDate lastEffectiveDate(RateTerm term);

    String version();

    /**
     * Date up to which the snapshot is known to be complete
     */
    LocalDate asOf();
}
