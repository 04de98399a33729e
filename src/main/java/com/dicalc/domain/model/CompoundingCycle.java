package com.dicalc.domain.model;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

/**
 * Interest settlement cycle for compound calculations.
 * A cycle boundary is the last calendar day of the month, quarter, half-year or year.
 */
public enum CompoundingCycle {
    MONTH_END(1),
    QUARTER_END(3),
    HALF_YEAR_END(6),
    YEAR_END(12);

    private final int months;

    CompoundingCycle(int months) {
        this.months = months;
    }

    public int getMonths() {
        return months;
    }

    public boolean isCycleEnd(LocalDate date) {
        return date.equals(date.withDayOfMonth(date.lengthOfMonth()))
                && date.getMonthValue() % months == 0;
    }

    /**
     * First cycle end on or after the given date
     */
    public LocalDate cycleEndOnOrAfter(LocalDate date) {
        int monthValue = date.getMonthValue();
        int endMonth = ((monthValue + months - 1) / months) * months;
        LocalDate monthStart = LocalDate.of(date.getYear(), Month.of(endMonth), 1);
        return monthStart.withDayOfMonth(monthStart.lengthOfMonth());
    }

    /**
     * Cycle ends falling inside [start, end], in ascending order
     */
    public List<LocalDate> cycleEndsBetween(LocalDate start, LocalDate end) {
        List<LocalDate> ends = new ArrayList<>();
        LocalDate cursor = cycleEndOnOrAfter(start);
        while (!cursor.isAfter(end)) {
            ends.add(cursor);
            cursor = cycleEndOnOrAfter(cursor.plusDays(1));
        }
        return ends;
    }

    /**
     * Accepts enum names and the short forms "month", "quarter", "half_year", "year"
     */
    public static CompoundingCycle fromValue(String value) {
        for (CompoundingCycle cycle : values()) {
            if (cycle.matches(value)) {
                return cycle;
            }
        }
        throw new IllegalArgumentException("Unknown compounding cycle: " + value);
    }

    public static boolean isValid(String value) {
        for (CompoundingCycle cycle : values()) {
            if (cycle.matches(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        String normalized = candidate.trim().replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
        return name().equals(normalized) || name().equals(normalized + "_END");
    }
}
