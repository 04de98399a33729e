package com.dicalc.domain.model;

import lombok.Value;

/**
 * Resolved base days of a year and where the value came from
 */
@Value
public class DayCountBasis {
    int baseDays;
    DayCountContext context;  // null when the caller gave base days explicitly
    boolean explicit;

    public static DayCountBasis explicit(int baseDays) {
        return new DayCountBasis(baseDays, null, true);
    }

    public static DayCountBasis fromContext(DayCountContext context) {
        return new DayCountBasis(context.getBaseDays(), context, false);
    }

    public String describeSource() {
        return explicit ? "explicit" : "context " + context.name();
    }
}
