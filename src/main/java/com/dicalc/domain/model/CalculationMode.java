package com.dicalc.domain.model;

import java.util.Set;

/**
 * Interest calculation mode selected by the caller
 */
public enum CalculationMode {
    SIMPLE("simple", Set.of()),
    FLOATING("lpr", Set.of("floating")),
    DELAYED("delay", Set.of("delayed")),
    COMPOUND("compound", Set.of()),
    PENALTY("penalty", Set.of());

    private final String value;
    private final Set<String> aliases;

    CalculationMode(String value, Set<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    public String getValue() {
        return value;
    }

    public static CalculationMode fromValue(String value) {
        for (CalculationMode mode : values()) {
            if (mode.matches(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown calculation mode: " + value);
    }

    public static boolean isValid(String value) {
        for (CalculationMode mode : values()) {
            if (mode.matches(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        String lower = candidate.trim().toLowerCase();
        return value.equals(lower) || aliases.contains(lower) || name().equalsIgnoreCase(lower);
    }
}
