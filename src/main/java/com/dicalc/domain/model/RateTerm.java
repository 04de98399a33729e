package com.dicalc.domain.model;

/**
 * Benchmark rate term published in the rate table
 */
public enum RateTerm {
    SHORT_TERM("1y"),
    LONG_TERM("5y");

    private final String value;

    RateTerm(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Accepts the short code ("1y", "5y") or the enum name in any case
     */
    public static RateTerm fromValue(String value) {
        for (RateTerm term : values()) {
            if (term.value.equalsIgnoreCase(value) || term.name().equalsIgnoreCase(normalize(value))) {
                return term;
            }
        }
        throw new IllegalArgumentException("Unknown rate term: " + value);
    }

    public static boolean isValid(String value) {
        for (RateTerm term : values()) {
            if (term.value.equalsIgnoreCase(value) || term.name().equalsIgnoreCase(normalize(value))) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        // ShortTerm -> SHORT_TERM
        return value.trim().replaceAll("([a-z])([A-Z])", "$1_$2");
    }
}
