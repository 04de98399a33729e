package com.dicalc.domain.model;

/**
 * Rate basis of a penalty calculation before the cap is checked
 */
public enum PenaltyBasis {
    FIXED,
    FLOATING;

    public static PenaltyBasis fromValue(String value) {
        for (PenaltyBasis basis : values()) {
            if (basis.name().equalsIgnoreCase(value)) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Unknown penalty basis: " + value);
    }

    public static boolean isValid(String value) {
        for (PenaltyBasis basis : values()) {
            if (basis.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
