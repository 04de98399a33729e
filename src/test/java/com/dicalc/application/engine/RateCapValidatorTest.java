package com.dicalc.application.engine;

import com.dicalc.application.engine.mode.SimpleInterestCalculator;
import com.dicalc.domain.exception.InvalidParameterException;
import com.dicalc.domain.model.CapResult;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.RateTerm;
import com.dicalc.domain.model.request.CalculationTerms;
import com.dicalc.domain.model.request.SimpleRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateCapValidatorTest {

    private DayCountEngine dayCount;
    private RateCapValidator validator;

    @BeforeEach
    void setUp() {
        dayCount = new DayCountEngine();
        validator = new RateCapValidator(TestRateTables.small(), dayCount);
    }

    @Test
    void capBelowRawTotalIsReportedAlongsideIt() {
        // 24% fixed against 4 x 4.00% = 16% over January 2024
        CalculationResult result = simpleResult("24", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        CapResult cap = validator.cap(result, BigDecimal.valueOf(4), RateTerm.SHORT_TERM);

        assertEquals(new BigDecimal("2066.67"), cap.getRawTotal());
        assertEquals(new BigDecimal("1377.78"), cap.getCapLimitTotal());
        assertEquals(new BigDecimal("1377.78"), cap.getCappedTotal());
        assertTrue(cap.isCapApplied());
        assertEquals(1, cap.getPeriodLimits().size());
    }

    @Test
    void rawTotalBelowCapIsKept() {
        CalculationResult result = simpleResult("6", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        CapResult cap = validator.cap(result, BigDecimal.valueOf(4), RateTerm.SHORT_TERM);

        assertEquals(cap.getRawTotal(), cap.getCappedTotal());
        assertFalse(cap.isCapApplied());
    }

    @Test
    void capUsesBenchmarkInForceAtEachPeriodStart() {
        // 1y rate drops from 4.00 to 3.00 on 2024-03-01
        Period february = period(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));
        Period march = period(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        CalculationResult result = CalculationResult.builder()
                .mode(CalculationMode.PENALTY)
                .principal(new BigDecimal("36000"))
                .dayCount(DayCountBasis.explicit(360))
                .period(PeriodResult.of(february, BigDecimal.valueOf(1000), "f"))
                .period(PeriodResult.of(march, BigDecimal.valueOf(1000), "f"))
                .rawTotal(BigDecimal.valueOf(2000))
                .build();

        CapResult cap = validator.cap(result, BigDecimal.ONE, RateTerm.SHORT_TERM);

        // 36000 x 4% / 360 x 29 = 116; 36000 x 3% / 360 x 31 = 93
        assertEquals(0, new BigDecimal("116").compareTo(cap.getPeriodLimits().get(0)));
        assertEquals(0, new BigDecimal("93").compareTo(cap.getPeriodLimits().get(1)));
        assertEquals(new BigDecimal("209.00"), cap.getCapLimitTotal());
    }

    @Test
    void capLimitGrowsWithMultiplier() {
        CalculationResult result = simpleResult("24", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 4, 30));
        BigDecimal previous = BigDecimal.ZERO;
        for (int multiplier = 1; multiplier <= 8; multiplier++) {
            CapResult cap = validator.cap(result, BigDecimal.valueOf(multiplier), RateTerm.SHORT_TERM);
            assertTrue(cap.getCapLimitTotal().compareTo(previous) >= 0);
            assertTrue(cap.getCappedTotal().compareTo(cap.getRawTotal()) <= 0);
            previous = cap.getCapLimitTotal();
        }
    }

    @Test
    void capWithoutAnnualBasisIsRejected() {
        CalculationResult result = CalculationResult.builder()
                .mode(CalculationMode.DELAYED)
                .rawTotal(BigDecimal.TEN)
                .build();

        assertThrows(InvalidParameterException.class,
                () -> validator.cap(result, BigDecimal.valueOf(4), RateTerm.SHORT_TERM));
    }

    private CalculationResult simpleResult(String rate, LocalDate start, LocalDate end) {
        SimpleRequest request = new SimpleRequest(CalculationTerms.of(new BigDecimal("100000"), start, end),
                new BigDecimal(rate), DayCountBasis.explicit(360));
        SimpleInterestCalculator calculator = new SimpleInterestCalculator(dayCount);
        List<Period> periods = new PeriodSegmenter(TestRateTables.small(), dayCount).segment(request);

        CalculationResult.CalculationResultBuilder builder = CalculationResult.builder()
                .mode(CalculationMode.SIMPLE)
                .principal(request.terms().principal())
                .dayCount(request.basis());
        BigDecimal raw = BigDecimal.ZERO;
        for (Period period : periods) {
            PeriodResult periodResult = calculator.accrue(period, request);
            builder.period(periodResult);
            raw = raw.add(periodResult.getSubInterest());
        }
        return builder.rawTotal(raw).totalInterest(DayCountEngine.roundCurrency(raw)).build();
    }

    private static Period period(LocalDate start, LocalDate end) {
        return Period.builder()
                .startDate(start)
                .endDate(end)
                .days((int) (end.toEpochDay() - start.toEpochDay() + 1))
                .principalBase(new BigDecimal("36000"))
                .build();
    }
}
