package com.dicalc.application.engine;

import com.dicalc.adapter.out.rates.SnapshotRateTableAdapter;
import com.dicalc.domain.exception.RateNotFoundException;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CompoundingCycle;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.Payment;
import com.dicalc.domain.model.PaymentOffsetPolicy;
import com.dicalc.domain.model.PenaltyBasis;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.RateTableEntry;
import com.dicalc.domain.model.RateTerm;
import com.dicalc.domain.model.WarningCode;
import com.dicalc.domain.model.request.CalculationTerms;
import com.dicalc.domain.model.request.CompoundRequest;
import com.dicalc.domain.model.request.DelayedRequest;
import com.dicalc.domain.model.request.FloatingRequest;
import com.dicalc.domain.model.request.PenaltyRequest;
import com.dicalc.domain.model.request.SimpleRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalculationModeDispatcherTest {

    private static final DayCountBasis BASE_360 = DayCountBasis.explicit(360);
    private static final BigDecimal HUNDRED_THOUSAND = new BigDecimal("100000");

    private final CalculationModeDispatcher dispatcher = TestEngines.dispatcher(TestRateTables.embedded());

    @Test
    void simpleInterestOverALeapYear() {
        SimpleRequest request = new SimpleRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)),
                new BigDecimal("4.35"), BASE_360);

        CalculationResult result = dispatcher.dispatch(request);

        assertEquals(1, result.getPeriods().size());
        assertEquals(366, result.getTotalDays());
        assertEquals(new BigDecimal("4422.50"), result.getTotalInterest());
        assertEquals("100000 × 4.35% ÷ 360 × 366", result.getPeriods().get(0).getFormula());
        assertNull(result.getCap());
        assertFalse(result.hasWarnings());
    }

    @Test
    void delayedInterestUsesDailyRateWithoutBaseDays() {
        DelayedRequest request = new DelayedRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2024, 6, 1), LocalDate.of(2024, 12, 31)));

        CalculationResult result = dispatcher.dispatch(request);

        assertEquals(214, result.getTotalDays());
        assertEquals(new BigDecimal("3745.00"), result.getTotalInterest());
        assertNull(result.getDayCount());
        assertEquals("100000 × 0.0175% × 214", result.getPeriods().get(0).getFormula());
    }

    @Test
    void floatingInterestIsSegmentedAtRateChanges() {
        FloatingRequest request = new FloatingRequest(
                CalculationTerms.of(new BigDecimal("200000"), LocalDate.of(2023, 6, 1), LocalDate.of(2023, 8, 21)),
                RateTerm.SHORT_TERM, new BigDecimal("1.5"), BASE_360, null, null);

        CalculationResult result = dispatcher.dispatch(request);

        List<PeriodResult> periods = result.getPeriods();
        assertEquals(3, periods.size());
        assertEquals(0, new BigDecimal("3.65").compareTo(periods.get(0).getPeriod().getBenchmarkRate()));
        assertEquals(0, new BigDecimal("3.55").compareTo(periods.get(1).getPeriod().getBenchmarkRate()));
        assertEquals(0, new BigDecimal("3.45").compareTo(periods.get(2).getPeriod().getBenchmarkRate()));
        assertEquals(0, new BigDecimal("28.75").compareTo(periods.get(2).getSubInterest()));
        assertEquals(new BigDecimal("2440.83"), result.getTotalInterest());
        assertEquals("200000 × (3.45% × 1.5) ÷ 360 × 1", periods.get(2).getFormula());
    }

    @Test
    void paymentReducesPrincipalBaseFromTheNextDay() {
        CalculationTerms terms = new CalculationTerms(
                HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31),
                List.of(new Payment(LocalDate.of(2024, 1, 10), new BigDecimal("7000"))),
                PaymentOffsetPolicy.GENERAL_DEBT, BigDecimal.ZERO, new BigDecimal("4900"));
        SimpleRequest request = new SimpleRequest(terms, new BigDecimal("3.6"), BASE_360);

        CalculationResult result = dispatcher.dispatch(request);

        // 4900 prior + 100 accrued over the first ten days = 5000 interest outstanding on the payment date
        assertEquals(2, result.getPeriods().size());
        assertEquals(0, new BigDecimal("100").compareTo(result.getPeriods().get(0).getSubInterest()));
        assertEquals(1, result.getAllocations().size());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getAllocations().get(0).getAllocation().getRemainingInterest()));
        assertEquals(0, new BigDecimal("98000").compareTo(result.getAllocations().get(0).getAllocation().getRemainingPrincipal()));
        assertEquals(0, new BigDecimal("98000").compareTo(result.getPeriods().get(1).getPeriod().getPrincipalBase()));
        assertTrue(result.getPeriods().get(1).getNote().startsWith("payment 7000 on 2024-01-10"));
        // 98000 x 3.6% / 360 x 21 = 205.8
        assertEquals(new BigDecimal("305.80"), result.getTotalInterest());
        assertEquals(0, new BigDecimal("98000").compareTo(result.getClosingBalance().getPrincipal()));
    }

    @Test
    void overpaymentAddsWarning() {
        CalculationTerms terms = CalculationTerms.of(new BigDecimal("1000"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31))
                .withPayments(List.of(new Payment(LocalDate.of(2024, 1, 31), new BigDecimal("5000"))),
                        PaymentOffsetPolicy.GENERAL_DEBT);

        CalculationResult result = dispatcher.dispatch(new SimpleRequest(terms, new BigDecimal("3.6"), BASE_360));

        assertTrue(result.hasWarnings());
        assertEquals(WarningCode.UNAPPLIED_REMAINDER, result.getWarnings().get(0).code());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getClosingBalance().getPrincipal()));
        assertEquals(1, result.getPeriods().size());
    }

    @Test
    void delayedPaymentsDefaultToJudgmentOrder() {
        CalculationTerms terms = new CalculationTerms(
                HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31),
                List.of(new Payment(LocalDate.of(2024, 1, 10), new BigDecimal("10000"))),
                PaymentOffsetPolicy.JUDGMENT_DEBT, null, null);

        CalculationResult result = dispatcher.dispatch(new DelayedRequest(terms));

        // the whole payment goes to the judgment principal, the accrued 175 stays outstanding
        assertEquals(0, new BigDecimal("90000").compareTo(result.getPeriods().get(1).getPeriod().getPrincipalBase()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getAllocations().get(0).getAllocation().getAppliedToInterest()));
    }

    @Test
    void delayedInterestAccruesOnTheWholeJudgmentAmount() {
        CalculationTerms terms = new CalculationTerms(
                HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31),
                List.of(new Payment(LocalDate.of(2024, 1, 10), new BigDecimal("101000"))),
                PaymentOffsetPolicy.JUDGMENT_DEBT, new BigDecimal("2000"), new BigDecimal("8000"));

        CalculationResult result = dispatcher.dispatch(new DelayedRequest(terms));

        // principal 100000 + judgment interest 8000 + costs 2000
        assertEquals(0, new BigDecimal("110000").compareTo(result.getPeriods().get(0).getPeriod().getPrincipalBase()));
        // 101000 clears principal, then 1000 of the judgment interest; costs are untouched
        assertEquals(0, new BigDecimal("1000").compareTo(result.getAllocations().get(0).getAllocation().getAppliedToPriorInterest()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getAllocations().get(0).getAllocation().getAppliedToCosts()));
        assertEquals(0, new BigDecimal("9000").compareTo(result.getPeriods().get(1).getPeriod().getPrincipalBase()));
        assertEquals(0, new BigDecimal("7000").compareTo(result.getClosingBalance().getPriorInterest()));
        assertEquals(0, new BigDecimal("2000").compareTo(result.getClosingBalance().getCosts()));
        // 110000 x 0.0175% x 10 + 9000 x 0.0175% x 21
        assertEquals(new BigDecimal("225.58"), result.getTotalInterest());
    }

    @Test
    void compoundCapitalisesAtEachCycleEnd() {
        CompoundRequest request = new CompoundRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 29)),
                new BigDecimal("3.6"), BASE_360, CompoundingCycle.MONTH_END);

        CalculationResult result = dispatcher.dispatch(request);

        assertEquals(2, result.getPeriods().size());
        assertEquals(0, new BigDecimal("310").compareTo(result.getPeriods().get(0).getSubInterest()));
        assertEquals(0, new BigDecimal("100310").compareTo(result.getPeriods().get(1).getPeriod().getPrincipalBase()));
        // 100310 x 3.6% / 360 x 29 = 290.899
        assertEquals(new BigDecimal("600.90"), result.getTotalInterest());
        assertEquals(0, new BigDecimal("100600.899").compareTo(result.getClosingBalance().getPrincipal()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getClosingBalance().getInterest()));
    }

    @Test
    void compoundTotalEqualsPrincipalGrowth() {
        CompoundRequest request = new CompoundRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2023, 11, 15), LocalDate.of(2025, 2, 10)),
                new BigDecimal("4.35"), DayCountBasis.explicit(365), CompoundingCycle.QUARTER_END);

        CalculationResult result = dispatcher.dispatch(request);

        BigDecimal growth = result.getClosingBalance().getPrincipal().subtract(HUNDRED_THOUSAND);
        assertEquals(DayCountEngine.roundCurrency(growth), result.getTotalInterest());
        assertEquals(0, growth.compareTo(result.getRawTotal()));
    }

    @Test
    void penaltyAlwaysReportsCap() {
        PenaltyRequest request = new PenaltyRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)),
                PenaltyBasis.FIXED, new BigDecimal("24"), null, null, BASE_360,
                BigDecimal.valueOf(4), RateTerm.SHORT_TERM);

        CalculationResult result = dispatcher.dispatch(request);

        assertNotNull(result.getCap());
        // 4 x 3.45% = 13.8%: 100000 x 13.8% / 360 x 31
        assertEquals(new BigDecimal("2066.67"), result.getTotalInterest());
        assertEquals(new BigDecimal("1188.33"), result.getCap().getCapLimitTotal());
        assertEquals(new BigDecimal("1188.33"), result.getCap().getCappedTotal());
        assertTrue(result.getCap().isCapApplied());
    }

    @Test
    void floatingCapIsOptional() {
        FloatingRequest request = new FloatingRequest(
                CalculationTerms.of(HUNDRED_THOUSAND, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)),
                RateTerm.LONG_TERM, BigDecimal.ONE, BASE_360, BigDecimal.valueOf(4), RateTerm.SHORT_TERM);

        CalculationResult result = dispatcher.dispatch(request);

        assertNotNull(result.getCap());
        assertFalse(result.getCap().isCapApplied());
        assertEquals(result.getTotalInterest(), result.getCap().getCappedTotal());
    }

    @Test
    void splittingTheRangeKeepsTheTotal() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate split = LocalDate.of(2024, 7, 15);
        LocalDate end = LocalDate.of(2024, 12, 31);

        CalculationResult whole = dispatcher.dispatch(floating(start, end));
        CalculationResult first = dispatcher.dispatch(floating(start, split));
        CalculationResult second = dispatcher.dispatch(floating(split.plusDays(1), end));

        BigDecimal parts = first.getRawTotal().add(second.getRawTotal());
        assertEquals(whole.getRawTotal().setScale(20, RoundingMode.HALF_UP), parts.setScale(20, RoundingMode.HALF_UP));
    }

    @Test
    void endAfterSnapshotIsForwardFilledWithWarning() {
        CalculationResult result = dispatcher.dispatch(floating(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 9, 30)));

        assertEquals(WarningCode.RATE_FORWARD_FILLED, result.getWarnings().get(0).code());
        assertEquals(0, new BigDecimal("3.00").compareTo(
                result.getPeriods().get(result.getPeriods().size() - 1).getPeriod().getBenchmarkRate()));
    }

    @Test
    void forwardFillIsMeasuredFromTheLaterOfAsOfAndLastEntry() {
        CalculationModeDispatcher small = TestEngines.dispatcher(TestRateTables.small());

        assertFalse(small.dispatch(floating(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 30))).hasWarnings());

        CalculationResult past = small.dispatch(floating(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 7, 10)));
        assertEquals(WarningCode.RATE_FORWARD_FILLED, past.getWarnings().get(0).code());
        assertTrue(past.getWarnings().get(0).message().contains("entry of 2024-03-01"));

        // an entry published after the as-of date still counts as known
        CalculationModeDispatcher ahead = TestEngines.dispatcher(new SnapshotRateTableAdapter("test-2", LocalDate.of(2024, 6, 30), List.of(
                new RateTableEntry(RateTerm.SHORT_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("4.00")),
                new RateTableEntry(RateTerm.SHORT_TERM, LocalDate.of(2024, 8, 1), new BigDecimal("3.50")),
                new RateTableEntry(RateTerm.LONG_TERM, LocalDate.of(2024, 1, 1), new BigDecimal("5.00")))));
        assertFalse(ahead.dispatch(floating(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 7, 31))).hasWarnings());
        assertTrue(ahead.dispatch(floating(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 8, 2))).hasWarnings());
    }

    @Test
    void dateBeforeFirstEntryIsRateNotFound() {
        RateNotFoundException error = assertThrows(RateNotFoundException.class,
                () -> dispatcher.dispatch(floating(LocalDate.of(2019, 1, 1), LocalDate.of(2019, 12, 31))));
        assertEquals(RateTerm.SHORT_TERM, error.getTerm());
        assertEquals(LocalDate.of(2019, 1, 1), error.getDate());
    }

    @Test
    void resultRecordsRateTableVersion() {
        CalculationResult result = dispatcher.dispatch(floating(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)));

        assertEquals("lpr-2025-07", result.getRateTableVersion());
        assertEquals(LocalDate.of(2025, 7, 21), result.getRateTableAsOf());
    }

    private static FloatingRequest floating(LocalDate start, LocalDate end) {
        return new FloatingRequest(CalculationTerms.of(HUNDRED_THOUSAND, start, end),
                RateTerm.SHORT_TERM, BigDecimal.ONE, BASE_360, null, null);
    }
}
