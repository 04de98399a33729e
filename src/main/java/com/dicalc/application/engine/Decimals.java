package com.dicalc.application.engine;

import java.math.BigDecimal;

/**
 * Text forms of decimals used in formulas and notes
 */
public final class Decimals {

    private Decimals() {
    }

    public static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    public static String money(BigDecimal value) {
        return DayCountEngine.roundCurrency(value).toPlainString();
    }
}
