package com.dicalc.domain.model;

/**
 * Order in which a payment is offset against outstanding buckets
 */
public enum PaymentOffsetPolicy {
    /** costs, then interest, then principal */
    GENERAL_DEBT,
    /** judgment-determined amount first, then accrued delayed-performance interest */
    JUDGMENT_DEBT;

    public static PaymentOffsetPolicy fromValue(String value) {
        for (PaymentOffsetPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown payment offset policy: " + value);
    }

    public static boolean isValid(String value) {
        for (PaymentOffsetPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
