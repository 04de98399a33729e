package com.dicalc.application.engine;

import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.domain.exception.InvalidPaymentDateException;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.Payment;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.RateTerm;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.CalculationTerms;
import com.dicalc.domain.model.request.CompoundRequest;
import com.dicalc.domain.model.request.DelayedRequest;
import com.dicalc.domain.model.request.FloatingRequest;
import com.dicalc.domain.model.request.PenaltyRequest;
import com.dicalc.domain.model.request.SimpleRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Splits a request range into periods at every date where the rate or the principal base can change.
 * <p>
 * Break points are the start date, the day after each payment, benchmark rate changes for the
 * terms the request is priced on, the day after each compounding cycle end and the day after the
 * end date as a sentinel. Coinciding break points collapse, so no period is ever empty.
 * Every period starts with the request principal as its base; the dispatcher rebases it as
 * payments are allocated.
 */
@Slf4j
@RequiredArgsConstructor
public class PeriodSegmenter {

    private final RateTableProvider rateTable;
    private final DayCountEngine dayCount;

    public List<Period> segment(CalculationRequest request) {
        CalculationTerms terms = request.terms();
        validatePayments(terms);

        NavigableSet<LocalDate> breakPoints = breakPoints(request);
        List<Period> periods = new ArrayList<>(breakPoints.size() - 1);

        LocalDate periodStart = breakPoints.first();
        for (LocalDate next : breakPoints.tailSet(periodStart, false)) {
            periods.add(buildPeriod(request, periodStart, next.minusDays(1)));
            periodStart = next;
        }

        log.debug("Segmented {} to {} into {} periods", terms.startDate(), terms.endDate(), periods.size());
        return List.copyOf(periods);
    }

    NavigableSet<LocalDate> breakPoints(CalculationRequest request) {
        CalculationTerms terms = request.terms();
        LocalDate start = terms.startDate();
        LocalDate end = terms.endDate();

        NavigableSet<LocalDate> points = new TreeSet<>();
        points.add(start);
        points.add(end.plusDays(1));

        for (Payment payment : terms.payments()) {
            points.add(payment.date().plusDays(1));
        }
        for (RateTerm term : request.pricingTerms()) {
            points.addAll(rateTable.rateChangeDates(term, start, end));
        }
        if (request instanceof CompoundRequest compound) {
            for (LocalDate cycleEnd : compound.cycle().cycleEndsBetween(start, end)) {
                points.add(cycleEnd.plusDays(1));
            }
        }
        return points;
    }

    private void validatePayments(CalculationTerms terms) {
        LocalDate previous = null;
        for (int i = 0; i < terms.payments().size(); i++) {
            LocalDate date = terms.payments().get(i).date();
            if (date.isBefore(terms.startDate()) || date.isAfter(terms.endDate())) {
                throw new InvalidPaymentDateException("payments[" + i + "].date",
                        String.format("payment date %s is outside %s to %s", date, terms.startDate(), terms.endDate()));
            }
            if (previous != null && date.isBefore(previous)) {
                throw new InvalidPaymentDateException("payments[" + i + "].date",
                        String.format("payment date %s is before the preceding payment on %s", date, previous));
            }
            previous = date;
        }
    }

    private Period buildPeriod(CalculationRequest request, LocalDate start, LocalDate end) {
        Period.PeriodBuilder builder = Period.builder()
                .startDate(start)
                .endDate(end)
                .days(dayCount.daysBetween(start, end))
                .principalBase(request.terms().principal());

        if (request instanceof DelayedRequest) {
            return builder.dailyRate(DelayedRequest.DAILY_RATE).build();
        }
        if (request instanceof FloatingRequest floating) {
            return priceOnBenchmark(builder, start, floating.term(), floating.multiplier(), floating.basis());
        }
        if (request instanceof PenaltyRequest penalty) {
            return penalty.isFloating()
                    ? priceOnBenchmark(builder, start, penalty.term(), penalty.multiplier(), penalty.dayCountBasis())
                    : priceFixed(builder, penalty.annualRatePercent(), penalty.dayCountBasis());
        }
        if (request instanceof SimpleRequest simple) {
            return priceFixed(builder, simple.annualRatePercent(), simple.basis());
        }
        if (request instanceof CompoundRequest compound) {
            return priceFixed(builder, compound.annualRatePercent(), compound.basis());
        }
        throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getSimpleName());
    }

    private Period priceOnBenchmark(Period.PeriodBuilder builder, LocalDate start, RateTerm term,
                                    BigDecimal multiplier, DayCountBasis basis) {
        BigDecimal benchmark = rateTable.lookup(term, start);
        BigDecimal applicable = benchmark.multiply(multiplier);
        return builder.benchmarkRate(benchmark)
                .applicableRate(applicable)
                .dailyRate(dayCount.dailyRate(applicable, basis.getBaseDays()))
                .build();
    }

    private Period priceFixed(Period.PeriodBuilder builder, BigDecimal annualRatePercent, DayCountBasis basis) {
        return builder.applicableRate(annualRatePercent)
                .dailyRate(dayCount.dailyRate(annualRatePercent, basis.getBaseDays()))
                .build();
    }
}
