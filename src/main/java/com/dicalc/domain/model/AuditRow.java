package com.dicalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One line of the calculation trail. Period rows carry everything needed to recompute the
 * sub-interest by hand; the single total row closes the table.
 */
@Value
public class AuditRow {

    public static final List<String> HEADERS = List.of(
            "No.", "From", "To", "Days", "Principal base", "Benchmark rate (%)", "Applied rate (%)",
            "Daily rate", "Interest", "Cap limit", "Formula", "Note");

    public enum RowType { PERIOD, TOTAL }

    RowType type;
    Integer sequence;
    LocalDate startDate;
    LocalDate endDate;
    int days;
    BigDecimal principalBase;
    BigDecimal benchmarkRate;
    BigDecimal applicableRate;
    BigDecimal dailyRate;
    BigDecimal interest;
    BigDecimal capLimit;
    String formula;
    String note;

    public boolean isTotal() {
        return type == RowType.TOTAL;
    }

    /**
     * Plain-text cells in header order; absent values render as "-"
     */
    public List<String> cells() {
        return List.of(
                sequence == null ? "Total" : sequence.toString(),
                String.valueOf(startDate),
                String.valueOf(endDate),
                Integer.toString(days),
                plain(principalBase),
                plain(benchmarkRate),
                plain(applicableRate),
                plain(dailyRate),
                plain(interest),
                plain(capLimit),
                formula == null ? "-" : formula,
                note == null ? "-" : note);
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.toPlainString();
    }
}
