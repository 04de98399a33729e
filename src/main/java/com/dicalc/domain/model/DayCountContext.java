package com.dicalc.domain.model;

/**
 * Legal context that decides the base days of a year when the caller does not give them explicitly.
 * Financial-institution lending counts 360 days; judicial and commercial contexts count 365.
 */
public enum DayCountContext {
    FINANCIAL(360),
    JUDICIAL(365),
    COMMERCIAL(365);

    private final int baseDays;

    DayCountContext(int baseDays) {
        this.baseDays = baseDays;
    }

    public int getBaseDays() {
        return baseDays;
    }

    public static DayCountContext fromValue(String value) {
        for (DayCountContext context : values()) {
            if (context.name().equalsIgnoreCase(value)) {
                return context;
            }
        }
        throw new IllegalArgumentException("Unknown day count context: " + value);
    }

    public static boolean isValid(String value) {
        for (DayCountContext context : values()) {
            if (context.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
