package com.dicalc.adapter.out.rates;

import com.dicalc.domain.exception.ErrorKind;
import com.dicalc.domain.exception.RateNotFoundException;
import com.dicalc.domain.model.RateTableEntry;
import com.dicalc.domain.model.RateTerm;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotRateTableAdapterTest {

    private static SnapshotRateTableAdapter table;

    @BeforeAll
    static void loadEmbeddedSnapshot() {
        table = SnapshotRateTableAdapter.fromSnapshot(new RateTableSnapshotLoader().load("rates/lpr-rates.yaml"));
    }

    @Test
    void testSnapshotMetadata() {
        assertEquals("lpr-2025-07", table.version());
        assertEquals(LocalDate.of(2025, 7, 21), table.asOf());
        assertEquals(LocalDate.of(2025, 7, 21), table.lastEffectiveDate(RateTerm.SHORT_TERM));
        assertEquals(LocalDate.of(2025, 7, 21), table.lastEffectiveDate(RateTerm.LONG_TERM));
    }

    @Test
    void testLookupUsesEntryInForce() {
        assertEquals(new BigDecimal("4.25"), table.lookup(RateTerm.SHORT_TERM, LocalDate.of(2019, 8, 20)));
        assertEquals(new BigDecimal("4.85"), table.lookup(RateTerm.LONG_TERM, LocalDate.of(2019, 9, 1)));
        // day before a publication still uses the previous one
        assertEquals(new BigDecimal("4.05"), table.lookup(RateTerm.SHORT_TERM, LocalDate.of(2020, 4, 19)));
        assertEquals(new BigDecimal("3.85"), table.lookup(RateTerm.SHORT_TERM, LocalDate.of(2020, 4, 20)));
    }

    @Test
    void testLookupAfterLastEntryCarriesForward() {
        assertEquals(new BigDecimal("3.00"), table.lookup(RateTerm.SHORT_TERM, LocalDate.of(2026, 1, 1)));
        assertEquals(new BigDecimal("3.50"), table.lookup(RateTerm.LONG_TERM, LocalDate.of(2030, 12, 31)));
    }

    @Test
    void testLookupBeforeFirstEntryFails() {
        RateNotFoundException e = assertThrows(RateNotFoundException.class,
                () -> table.lookup(RateTerm.LONG_TERM, LocalDate.of(2019, 8, 19)));
        assertEquals(ErrorKind.RATE_NOT_FOUND, e.getKind());
        assertEquals(RateTerm.LONG_TERM, e.getTerm());
        assertTrue(e.getMessage().contains("2019-08-20"));
    }

    @Test
    void testRateChangeDatesSkipUnchangedPublications() {
        List<LocalDate> changes = table.rateChangeDates(RateTerm.SHORT_TERM,
                LocalDate.of(2020, 3, 1), LocalDate.of(2020, 12, 31));

        // 2020-03-20 republished 4.05, only 2020-04-20 moved to 3.85
        assertEquals(List.of(LocalDate.of(2020, 4, 20)), changes);
    }

    @Test
    void testRateChangeDatesExcludeStartIncludeEnd() {
        assertEquals(List.of(), table.rateChangeDates(RateTerm.SHORT_TERM,
                LocalDate.of(2020, 4, 20), LocalDate.of(2020, 4, 30)));
        assertEquals(List.of(LocalDate.of(2020, 4, 20)), table.rateChangeDates(RateTerm.SHORT_TERM,
                LocalDate.of(2020, 4, 1), LocalDate.of(2020, 4, 20)));
    }

    @Test
    void testTermsChangeIndependently() {
        LocalDate start = LocalDate.of(2022, 4, 1);
        LocalDate end = LocalDate.of(2022, 9, 1);

        assertEquals(List.of(LocalDate.of(2022, 8, 22)), table.rateChangeDates(RateTerm.SHORT_TERM, start, end));
        assertEquals(List.of(LocalDate.of(2022, 5, 20), LocalDate.of(2022, 8, 22)),
                table.rateChangeDates(RateTerm.LONG_TERM, start, end));
    }

    @Test
    void testDuplicateEntryRejected() {
        List<RateTableEntry> entries = List.of(
                new RateTableEntry(RateTerm.SHORT_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("4.00")),
                new RateTableEntry(RateTerm.SHORT_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("3.90")),
                new RateTableEntry(RateTerm.LONG_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("5.00")));

        assertThrows(IllegalArgumentException.class,
                () -> new SnapshotRateTableAdapter("dup", LocalDate.of(2024, 1, 1), entries));
    }

    @Test
    void testMissingTermRejected() {
        List<RateTableEntry> entries = List.of(
                new RateTableEntry(RateTerm.SHORT_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("4.00")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new SnapshotRateTableAdapter("partial", LocalDate.of(2024, 1, 1), entries));
        assertTrue(e.getMessage().contains("5y"));
    }
}
