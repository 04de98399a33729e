package com.dicalc.application.engine;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DecimalsTest {

    @Test
    void plainDropsTrailingZerosWithoutExponent() {
        assertEquals("100000", Decimals.plain(new BigDecimal("1E+5")));
        assertEquals("4.35", Decimals.plain(new BigDecimal("4.3500")));
        assertEquals("0", Decimals.plain(new BigDecimal("0.000")));
        assertEquals("0.000175", Decimals.plain(new BigDecimal("0.0001750")));
    }

    @Test
    void moneyRoundsHalfUpToCents() {
        assertEquals("225.58", Decimals.money(new BigDecimal("225.575")));
        assertEquals("4422.50", Decimals.money(new BigDecimal("4422.5")));
    }
}
